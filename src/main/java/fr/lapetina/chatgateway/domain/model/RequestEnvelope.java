package fr.lapetina.chatgateway.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A translated request on its way to the upstream: flattened prompt,
 * resolved model and the credentials already tried for it.
 *
 * The exclusion set belongs to this request only and is never shared.
 * Not thread-safe; a request is driven by one dispatcher thread at a time.
 */
public final class RequestEnvelope {

    private final String requestId;
    private final String prompt;
    private final String modelAlias;
    private final String upstreamModel;
    private final boolean stream;
    private final Instant createdAt;
    private final Set<String> excluded = new LinkedHashSet<>();

    public RequestEnvelope(
            String requestId,
            String prompt,
            String modelAlias,
            String upstreamModel,
            boolean stream,
            Instant createdAt
    ) {
        this.requestId = Objects.requireNonNull(requestId, "Request ID is required");
        this.prompt = Objects.requireNonNull(prompt, "Prompt is required");
        this.modelAlias = Objects.requireNonNull(modelAlias, "Model alias is required");
        this.upstreamModel = Objects.requireNonNull(upstreamModel, "Upstream model is required");
        this.stream = stream;
        this.createdAt = createdAt != null ? createdAt : Instant.now();
    }

    public String getRequestId() {
        return requestId;
    }

    public String getPrompt() {
        return prompt;
    }

    public String getModelAlias() {
        return modelAlias;
    }

    public String getUpstreamModel() {
        return upstreamModel;
    }

    public boolean isStream() {
        return stream;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void exclude(String credentialId) {
        excluded.add(credentialId);
    }

    /**
     * Credential ids tried so far for this request, in the order they were tried.
     */
    public Set<String> getExcluded() {
        return Collections.unmodifiableSet(excluded);
    }

    @Override
    public String toString() {
        return "RequestEnvelope{" +
                "requestId='" + requestId + '\'' +
                ", model=" + modelAlias + "->" + upstreamModel +
                ", stream=" + stream +
                ", excluded=" + excluded +
                '}';
    }
}
