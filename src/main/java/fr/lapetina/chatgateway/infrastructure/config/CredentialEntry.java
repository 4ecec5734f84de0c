package fr.lapetina.chatgateway.infrastructure.config;

import fr.lapetina.chatgateway.domain.model.SecretPair;

import java.util.Objects;

/**
 * One credential found in the environment, before registration in the pool.
 */
public record CredentialEntry(SecretPair secretPair, String displayName) {

    public CredentialEntry {
        Objects.requireNonNull(secretPair, "Secret pair is required");
    }

    public static CredentialEntry of(String primary, String secondary, String displayName) {
        return new CredentialEntry(new SecretPair(primary, secondary), displayName);
    }
}
