package fr.lapetina.chatgateway.domain.model;

import java.time.Instant;

/**
 * Point-in-time copy of one credential's state, as reported by the pool status.
 * {@code lastUsed} is {@link Instant#EPOCH} for a credential never selected.
 */
public record CredentialSnapshot(
        String id,
        String displayName,
        boolean available,
        int errorCount,
        Instant lastUsed
) {
    public boolean neverUsed() {
        return Instant.EPOCH.equals(lastUsed);
    }
}
