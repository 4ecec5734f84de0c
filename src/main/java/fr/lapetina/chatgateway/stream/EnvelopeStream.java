package fr.lapetina.chatgateway.stream;

import fr.lapetina.chatgateway.domain.model.ErrorKind;
import fr.lapetina.chatgateway.domain.model.OutputEnvelope;
import fr.lapetina.chatgateway.domain.pool.CredentialPool;
import fr.lapetina.chatgateway.infrastructure.upstream.UpstreamException;
import fr.lapetina.chatgateway.infrastructure.upstream.UpstreamReply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Lazy, finite sequence of output envelopes for one request.
 *
 * Yields one delta envelope per non-empty upstream delta, numbered from 0,
 * then exactly one terminal envelope. Upstream deltas are pulled only when the
 * consumer asks for the next envelope. The sequence cannot be restarted.
 *
 * {@link #cancel()} before the terminal envelope aborts the upstream reply and
 * ends the sequence without a terminal envelope; the credential is not blamed.
 */
public final class EnvelopeStream implements Iterator<OutputEnvelope>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EnvelopeStream.class);

    private final String requestId;
    private final CredentialPool pool;
    private final String credentialId;
    private final UpstreamReply reply;

    private long nextSequence = 0;
    private OutputEnvelope pending;
    private boolean terminated;
    private volatile boolean cancelled;

    EnvelopeStream(String requestId, CredentialPool pool, String credentialId, UpstreamReply reply) {
        this.requestId = requestId;
        this.pool = pool;
        this.credentialId = credentialId;
        this.reply = reply;
    }

    /**
     * A stream holding only a terminal error envelope, for requests that never got a reply.
     */
    static EnvelopeStream failed(String requestId, ErrorKind kind, String message) {
        EnvelopeStream stream = new EnvelopeStream(requestId, null, null, null);
        stream.pending = OutputEnvelope.failed(0, "", kind, message);
        stream.terminated = true;
        return stream;
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (terminated || cancelled) {
            return false;
        }
        pending = produce();
        return pending != null;
    }

    @Override
    public OutputEnvelope next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Envelope stream is finished");
        }
        OutputEnvelope envelope = pending;
        pending = null;
        return envelope;
    }

    private OutputEnvelope produce() {
        try {
            while (!cancelled) {
                Optional<String> delta = reply.nextDelta();
                if (delta.isEmpty()) {
                    terminated = true;
                    return OutputEnvelope.finished(nextSequence++, "");
                }
                if (!delta.get().isEmpty()) {
                    return OutputEnvelope.delta(nextSequence++, delta.get());
                }
            }
            return null;
        } catch (UpstreamException e) {
            terminated = true;
            if (cancelled) {
                return null;
            }
            pool.reportFailure(credentialId);
            log.warn("Upstream failed mid-stream: requestId={}, credential={}, errorKind={}, envelopes={}, error={}",
                    requestId, credentialId, e.getKind(), nextSequence, e.getMessage());
            return OutputEnvelope.failed(nextSequence++, "", e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            terminated = true;
            reply.cancel();
            log.error("Reply production failed: requestId={}, credential={}", requestId, credentialId, e);
            return OutputEnvelope.failed(nextSequence++, "", ErrorKind.INTERNAL_ERROR, "Internal error: " + e.getMessage());
        }
    }

    /**
     * Stops the sequence. Idempotent; a no-op once the terminal envelope was produced.
     */
    public void cancel() {
        if (terminated || cancelled) {
            return;
        }
        cancelled = true;
        pending = null;
        if (reply != null) {
            reply.cancel();
        }
        log.info("Stream cancelled: requestId={}, credential={}, envelopes={}", requestId, credentialId, nextSequence);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public void close() {
        cancel();
    }
}
