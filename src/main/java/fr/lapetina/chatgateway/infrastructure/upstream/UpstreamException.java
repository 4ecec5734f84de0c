package fr.lapetina.chatgateway.infrastructure.upstream;

import fr.lapetina.chatgateway.domain.model.ErrorKind;

import java.util.Objects;

/**
 * Failure reported by a {@link SessionAdapter}, classified by {@link ErrorKind}.
 *
 * {@code transientFailure} marks an {@link ErrorKind#UPSTREAM_ERROR} that is worth
 * retrying on another credential (typically an upstream 5xx).
 */
public class UpstreamException extends Exception {

    private final ErrorKind kind;
    private final boolean transientFailure;

    public UpstreamException(ErrorKind kind, String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "Error kind is required");
        this.transientFailure = transientFailure;
    }

    public UpstreamException(ErrorKind kind, String message) {
        this(kind, message, false, null);
    }

    public UpstreamException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, false, cause);
    }

    public static UpstreamException transientError(String message) {
        return new UpstreamException(ErrorKind.UPSTREAM_ERROR, message, true, null);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    /**
     * Whether another credential may succeed where this one failed.
     */
    public boolean isRetryable() {
        return kind.isRetryable() || (kind == ErrorKind.UPSTREAM_ERROR && transientFailure);
    }
}
