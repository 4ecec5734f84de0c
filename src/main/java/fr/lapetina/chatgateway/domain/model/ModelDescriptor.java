package fr.lapetina.chatgateway.domain.model;

import java.util.Objects;

/**
 * A client-facing model alias and the upstream model it resolves to.
 */
public record ModelDescriptor(
        String alias,
        String upstreamId,
        String tier,
        boolean deprecated
) {
    public ModelDescriptor {
        Objects.requireNonNull(alias, "Alias is required");
        Objects.requireNonNull(upstreamId, "Upstream ID is required");
        tier = tier != null ? tier : "standard";
    }
}
