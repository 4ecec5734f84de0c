package fr.lapetina.chatgateway.domain.model;

import java.util.Objects;

/**
 * The two opaque tokens that authenticate one upstream identity.
 * The secondary token may be empty for identities that only need one.
 */
public record SecretPair(String primary, String secondary) {

    public SecretPair {
        Objects.requireNonNull(primary, "Primary secret is required");
        if (primary.isBlank()) {
            throw new IllegalArgumentException("Primary secret must not be blank");
        }
        secondary = secondary != null ? secondary : "";
    }

    public static SecretPair of(String primary) {
        return new SecretPair(primary, "");
    }

    /**
     * Never renders the tokens, so a pair formatted into a log line stays masked.
     */
    @Override
    public String toString() {
        return secondary.isEmpty() ? "SecretPair{***}" : "SecretPair{***, ***}";
    }
}
