package fr.lapetina.chatgateway.domain.strategy;

import fr.lapetina.chatgateway.domain.pool.CredentialRecord;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Strategy interface for picking a credential from the pool.
 *
 * The pool calls {@link #select} while holding its lock, so implementations
 * may keep plain mutable state (such as a rotation cursor) without further
 * synchronization. They must not block or perform I/O.
 */
public interface SelectionStrategy {

    /**
     * Returns the name of this strategy for configuration and metrics.
     */
    String getName();

    /**
     * Picks one eligible credential.
     *
     * @param records  every registered credential, in registration order
     * @param eligible filter accepting available, non-excluded credentials
     * @return the chosen credential, or empty if none is eligible
     */
    Optional<CredentialRecord> select(List<CredentialRecord> records, Predicate<CredentialRecord> eligible);

    /**
     * Resets any internal state. Called when the pool switches to this strategy.
     */
    default void reset() {
        // Default no-op
    }
}
