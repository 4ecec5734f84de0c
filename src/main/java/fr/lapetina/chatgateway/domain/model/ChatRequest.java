package fr.lapetina.chatgateway.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Inbound chat completion request, as received from the client.
 * Immutable and thread-safe. Structural validation happens in the pipeline,
 * so this record accepts incomplete input and only normalizes nulls.
 */
public record ChatRequest(
        String requestId,
        String model,
        List<Message> messages,
        boolean stream,
        Instant createdAt
) {
    public ChatRequest {
        if (requestId == null) {
            requestId = "chatcmpl-" + UUID.randomUUID().toString().replace("-", "");
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        messages = messages != null ? List.copyOf(messages) : List.of();
    }

    /**
     * One role-tagged message. The role is kept as sent so that validation
     * can report unknown roles instead of failing at parse time.
     */
    public record Message(String role, String content) {
    }

    public static ChatRequest of(String model, List<Message> messages, boolean stream) {
        return new ChatRequest(null, model, messages, stream, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String model;
        private List<Message> messages;
        private boolean stream;
        private Instant createdAt;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder messages(List<Message> messages) {
            this.messages = messages;
            return this;
        }

        public Builder stream(boolean stream) {
            this.stream = stream;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public ChatRequest build() {
            return new ChatRequest(requestId, model, messages, stream, createdAt);
        }
    }
}
