package fr.lapetina.chatgateway.stream;

import fr.lapetina.chatgateway.dispatch.DispatchOutcome;
import fr.lapetina.chatgateway.domain.model.ErrorKind;
import fr.lapetina.chatgateway.domain.model.OutputEnvelope;
import fr.lapetina.chatgateway.domain.model.RequestEnvelope;
import fr.lapetina.chatgateway.domain.pool.CredentialPool;

import java.util.Objects;

/**
 * Turns a dispatch outcome into output envelopes, either as a lazy stream or
 * as one aggregated envelope.
 *
 * Both forms read the same envelope sequence, so the aggregated body is
 * always the concatenation of the streamed deltas.
 */
public final class StreamEncoder {

    private final CredentialPool pool;

    public StreamEncoder(CredentialPool pool) {
        this.pool = Objects.requireNonNull(pool, "Pool is required");
    }

    /**
     * Opens the envelope sequence for a dispatched request. A failed outcome
     * yields a single terminal error envelope.
     */
    public EnvelopeStream stream(DispatchOutcome outcome, RequestEnvelope envelope) {
        if (!outcome.isSuccess()) {
            ErrorKind kind = outcome.errorKind() != null ? outcome.errorKind() : ErrorKind.INTERNAL_ERROR;
            return EnvelopeStream.failed(envelope.getRequestId(), kind, outcome.errorMessage());
        }
        return new EnvelopeStream(envelope.getRequestId(), pool, outcome.credentialId(), outcome.reply());
    }

    /**
     * Drains the sequence into one terminal envelope carrying the full body.
     * On a mid-production failure the envelope keeps the text produced so far.
     */
    public OutputEnvelope aggregate(DispatchOutcome outcome, RequestEnvelope envelope) {
        StringBuilder body = new StringBuilder();
        try (EnvelopeStream stream = stream(outcome, envelope)) {
            while (stream.hasNext()) {
                OutputEnvelope next = stream.next();
                body.append(next.text());
                if (next.isTerminal()) {
                    if (next.isError()) {
                        return OutputEnvelope.failed(0, body.toString(), next.errorKind(), next.errorMessage());
                    }
                    return OutputEnvelope.finished(0, body.toString());
                }
            }
        }
        // Only reachable if the stream was cancelled from another thread
        return OutputEnvelope.failed(0, body.toString(), ErrorKind.CANCELLED, "Response cancelled");
    }
}
