package fr.lapetina.chatgateway.dispatch;

import fr.lapetina.chatgateway.domain.model.ErrorKind;
import fr.lapetina.chatgateway.domain.model.RequestEnvelope;
import fr.lapetina.chatgateway.domain.pool.CredentialPool;
import fr.lapetina.chatgateway.domain.pool.CredentialRecord;
import fr.lapetina.chatgateway.domain.pool.PoolExhaustedException;
import fr.lapetina.chatgateway.infrastructure.upstream.SessionAdapter;
import fr.lapetina.chatgateway.infrastructure.upstream.UpstreamException;
import fr.lapetina.chatgateway.infrastructure.upstream.UpstreamReply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives one request through credential selection, upstream send and retry.
 *
 * Credential-scoped failures are reported to the pool and retried on another
 * credential until the attempt bound is reached. Request-scoped failures end
 * the dispatch immediately and leave credential state untouched.
 *
 * A dispatcher is stateless between calls; the per-request state lives in the
 * {@link RequestEnvelope} (exclusion set) and in locals.
 */
public final class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final CredentialPool pool;
    private final SessionAdapter adapter;
    private final Executor sendExecutor;
    private final Duration sendTimeout;
    private final int maxAttempts;

    /**
     * @param maxAttempts attempt bound per request; 0 or less uses the pool size
     */
    public Dispatcher(
            CredentialPool pool,
            SessionAdapter adapter,
            Executor sendExecutor,
            Duration sendTimeout,
            int maxAttempts
    ) {
        this.pool = Objects.requireNonNull(pool, "Pool is required");
        this.adapter = Objects.requireNonNull(adapter, "Session adapter is required");
        this.sendExecutor = Objects.requireNonNull(sendExecutor, "Send executor is required");
        this.sendTimeout = Objects.requireNonNull(sendTimeout, "Send timeout is required");
        this.maxAttempts = maxAttempts;
    }

    /**
     * Runs the state machine to completion. Never throws for upstream or pool
     * failures; those end up in the returned outcome.
     */
    public DispatchOutcome dispatch(RequestEnvelope envelope) {
        int bound = effectiveMaxAttempts();
        List<DispatchState> trace = new ArrayList<>();
        List<String> tried = new ArrayList<>();
        int attempts = 0;
        String lastCredential = null;

        while (true) {
            trace.add(DispatchState.SELECTING);
            CredentialRecord credential;
            try {
                credential = pool.select(envelope.getExcluded());
            } catch (PoolExhaustedException e) {
                trace.add(DispatchState.FAILED);
                log.warn("Dispatch failed, no eligible credential: requestId={}, attempts={}, tried={}",
                        envelope.getRequestId(), attempts, tried);
                return DispatchOutcome.failure(ErrorKind.ALL_CREDENTIALS_EXHAUSTED,
                        "All credentials are unavailable or already tried", lastCredential, attempts, tried, trace);
            }

            trace.add(DispatchState.SENDING);
            attempts++;
            lastCredential = credential.getId();
            tried.add(credential.getId());

            log.info("Dispatching request: requestId={}, model={}, credential={}, attempt={}/{}",
                    envelope.getRequestId(), envelope.getUpstreamModel(), credential.getId(), attempts, bound);

            UpstreamReply reply;
            try {
                reply = send(credential, envelope);
            } catch (UpstreamException e) {
                if (!e.isRetryable()) {
                    trace.add(DispatchState.FAILED);
                    log.warn("Dispatch failed: requestId={}, credential={}, errorKind={}, error={}",
                            envelope.getRequestId(), credential.getId(), e.getKind(), e.getMessage());
                    return DispatchOutcome.failure(e.getKind(), e.getMessage(), lastCredential, attempts, tried, trace);
                }

                pool.reportFailure(credential.getId());
                envelope.exclude(credential.getId());
                trace.add(DispatchState.RETRYING);
                log.warn("Attempt failed, rotating credential: requestId={}, credential={}, errorKind={}, error={}",
                        envelope.getRequestId(), credential.getId(), e.getKind(), e.getMessage());

                if (attempts >= bound) {
                    trace.add(DispatchState.FAILED);
                    log.error("Dispatch failed, retries exhausted: requestId={}, attempts={}, tried={}",
                            envelope.getRequestId(), attempts, tried);
                    return DispatchOutcome.failure(ErrorKind.RETRIES_EXHAUSTED,
                            "Gave up after " + attempts + " attempts; last error: " + e.getMessage(),
                            lastCredential, attempts, tried, trace);
                }
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                trace.add(DispatchState.FAILED);
                return DispatchOutcome.failure(ErrorKind.CANCELLED, "Dispatch interrupted",
                        lastCredential, attempts, tried, trace);
            } catch (RuntimeException e) {
                trace.add(DispatchState.FAILED);
                log.error("Dispatch failed unexpectedly: requestId={}, credential={}",
                        envelope.getRequestId(), credential.getId(), e);
                return DispatchOutcome.failure(ErrorKind.INTERNAL_ERROR, "Internal error: " + e.getMessage(),
                        lastCredential, attempts, tried, trace);
            }

            pool.reportSuccess(credential.getId());
            trace.add(DispatchState.SUCCEEDED);
            log.info("Dispatch succeeded: requestId={}, credential={}, attempts={}",
                    envelope.getRequestId(), credential.getId(), attempts);
            return DispatchOutcome.success(credential.getId(), reply, attempts, tried, trace);
        }
    }

    /**
     * Sends on the executor so that the send timeout holds even when the adapter blocks.
     */
    private UpstreamReply send(CredentialRecord credential, RequestEnvelope envelope)
            throws UpstreamException, InterruptedException {
        CompletableFuture<UpstreamReply> future = CompletableFuture.supplyAsync(() -> {
            try {
                return adapter.send(credential, envelope.getPrompt(), envelope.getUpstreamModel());
            } catch (UpstreamException e) {
                throw new CompletionException(e);
            }
        }, sendExecutor);

        try {
            return future.get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // Cancelling the future would drop a late reply unreleased; abort it once it arrives
            future.thenAccept(UpstreamReply::cancel);
            throw new UpstreamException(ErrorKind.NETWORK_ERROR,
                    "Upstream did not answer within " + sendTimeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UpstreamException) {
                throw (UpstreamException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Session adapter failed", cause);
        }
    }

    public int effectiveMaxAttempts() {
        return maxAttempts > 0 ? maxAttempts : Math.max(1, pool.size());
    }
}
