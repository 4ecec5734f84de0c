package fr.lapetina.chatgateway.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.chatgateway.domain.model.CredentialSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Response of {@code GET /credentials/status}. Secrets are never included.
 */
public record PoolStatusResponse(
        @JsonProperty("total_credentials") int totalCredentials,
        @JsonProperty("available_credentials") int availableCredentials,
        String strategy,
        List<CredentialStatus> credentials
) {

    public static PoolStatusResponse of(List<CredentialSnapshot> snapshots, String strategy) {
        List<CredentialStatus> credentials = snapshots.stream()
                .map(CredentialStatus::of)
                .toList();
        int available = (int) snapshots.stream().filter(CredentialSnapshot::available).count();
        return new PoolStatusResponse(snapshots.size(), available, strategy, credentials);
    }

    public record CredentialStatus(
            String id,
            @JsonProperty("display_name") String displayName,
            @JsonProperty("is_available") boolean available,
            @JsonProperty("error_count") int errorCount,
            @JsonProperty("last_used") Instant lastUsed
    ) {
        static CredentialStatus of(CredentialSnapshot snapshot) {
            return new CredentialStatus(
                    snapshot.id(),
                    snapshot.displayName(),
                    snapshot.available(),
                    snapshot.errorCount(),
                    snapshot.neverUsed() ? null : snapshot.lastUsed()
            );
        }
    }
}
