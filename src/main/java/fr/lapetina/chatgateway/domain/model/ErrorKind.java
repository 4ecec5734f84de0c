package fr.lapetina.chatgateway.domain.model;

/**
 * Error taxonomy for chat completion requests.
 * Each kind knows whether the dispatcher may retry it on another credential
 * and which HTTP status the API surface reports for it.
 */
public enum ErrorKind {
    /** No usable credential configuration at startup */
    CONFIG_ERROR(false, 500),

    /** Request body is structurally invalid (missing messages, unknown role, ...) */
    MALFORMED_REQUEST(false, 400),

    /** Model alias is not in the catalog */
    UNKNOWN_MODEL(false, 400),

    /** No eligible credential left when selecting */
    ALL_CREDENTIALS_EXHAUSTED(false, 503),

    /** Attempt bound reached while credentials kept failing */
    RETRIES_EXHAUSTED(false, 503),

    /** Upstream rejected the credential's session */
    AUTH_EXPIRED(true, 502),

    /** Upstream throttled the credential */
    RATE_LIMITED(true, 502),

    /** Connection failure or send timeout */
    NETWORK_ERROR(true, 502),

    /** Upstream answered with an error; retryable only when flagged transient */
    UPSTREAM_ERROR(false, 502),

    /** Intake ring buffer is full */
    BACKPRESSURE(false, 503),

    /** Request did not complete within the request timeout */
    TIMEOUT(false, 504),

    /** Client went away before the response completed */
    CANCELLED(false, 499),

    /** Internal system error */
    INTERNAL_ERROR(false, 500);

    private final boolean retryable;
    private final int httpStatus;

    ErrorKind(boolean retryable, int httpStatus) {
        this.retryable = retryable;
        this.httpStatus = httpStatus;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
