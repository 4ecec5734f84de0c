package fr.lapetina.chatgateway.infrastructure.upstream;

import java.util.Optional;

/**
 * A reply being produced by the upstream for one request.
 *
 * Deltas are pulled one at a time; concatenating every delta yields the full
 * reply text. An empty result means the reply is complete.
 */
public interface UpstreamReply extends AutoCloseable {

    /**
     * @return the next piece of text, or empty once the reply is complete
     * @throws UpstreamException if the upstream fails while producing the reply
     */
    Optional<String> nextDelta() throws UpstreamException;

    /**
     * Aborts production. Idempotent; no delta is returned afterwards.
     */
    void cancel();

    @Override
    default void close() {
        cancel();
    }
}
