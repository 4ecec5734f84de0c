package fr.lapetina.chatgateway.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.chatgateway.dispatch.DispatchOutcome;
import fr.lapetina.chatgateway.dispatch.DispatchResult;
import fr.lapetina.chatgateway.dispatch.Dispatcher;
import fr.lapetina.chatgateway.domain.event.ChatRequestEvent;
import fr.lapetina.chatgateway.domain.event.EventState;
import fr.lapetina.chatgateway.domain.model.ErrorKind;
import fr.lapetina.chatgateway.domain.model.RequestEnvelope;
import fr.lapetina.chatgateway.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Third stage handler: hands translated requests to the dispatcher.
 *
 * The dispatcher blocks on upstream I/O, so it runs on a worker executor and
 * never on the ring buffer consumer thread. Everything the worker needs is
 * copied out of the event first, because the event is recycled as soon as the
 * remaining handlers are done with it.
 *
 * Requests that failed an earlier stage complete here with their error.
 */
public final class DispatchHandler implements EventHandler<ChatRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(DispatchHandler.class);

    private final Dispatcher dispatcher;
    private final Executor workerExecutor;
    private final MetricsRegistry metricsRegistry;

    public DispatchHandler(Dispatcher dispatcher, Executor workerExecutor, MetricsRegistry metricsRegistry) {
        this.dispatcher = dispatcher;
        this.workerExecutor = workerExecutor;
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(ChatRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            completeWithError(event);
            return;
        }

        if (event.getState() != EventState.TRANSLATED) {
            event.markFailed(ErrorKind.INTERNAL_ERROR, "Invalid state for dispatch: " + event.getState());
            completeWithError(event);
            return;
        }

        dispatchRequest(event);
    }

    private void dispatchRequest(ChatRequestEvent event) {
        RequestEnvelope envelope = event.getEnvelope();
        CompletableFuture<DispatchResult> future = event.getResultFuture();
        Instant acceptedAt = event.getAcceptedAt();
        event.markDispatched();

        try {
            workerExecutor.execute(() -> runDispatch(envelope, future, acceptedAt));
        } catch (RejectedExecutionException e) {
            log.error("Dispatch rejected: requestId={}, error={}", envelope.getRequestId(), e.getMessage());
            metricsRegistry.incrementErrorCount(envelope.getModelAlias(), ErrorKind.INTERNAL_ERROR);
            complete(future, DispatchResult.rejected(ErrorKind.INTERNAL_ERROR, "Dispatch workers unavailable"));
        }
    }

    private void runDispatch(RequestEnvelope envelope, CompletableFuture<DispatchResult> future, Instant acceptedAt) {
        MDC.put("requestId", envelope.getRequestId());
        Instant start = Instant.now();
        try {
            DispatchOutcome outcome = dispatcher.dispatch(envelope);
            recordMetrics(envelope, outcome, acceptedAt, start);
            complete(future, new DispatchResult(envelope, outcome));
        } catch (RuntimeException e) {
            log.error("Dispatch crashed: requestId={}", envelope.getRequestId(), e);
            complete(future, new DispatchResult(envelope,
                    DispatchOutcome.rejected(ErrorKind.INTERNAL_ERROR, "Internal error: " + e.getMessage())));
        } finally {
            MDC.remove("requestId");
        }
    }

    private void recordMetrics(RequestEnvelope envelope, DispatchOutcome outcome, Instant acceptedAt, Instant start) {
        String model = envelope.getModelAlias();
        String result = outcome.isSuccess() ? "success" : "failure";
        Instant now = Instant.now();

        metricsRegistry.recordStageLatency("dispatch", Duration.between(start, now));
        metricsRegistry.recordDispatchAttempts(outcome.attempts());
        metricsRegistry.incrementRequestCount(model, result);
        if (acceptedAt != null) {
            metricsRegistry.recordLatency(model, result, Duration.between(acceptedAt, now));
        }
        if (!outcome.isSuccess()) {
            metricsRegistry.incrementErrorCount(model, outcome.errorKind());
        }
    }

    private void completeWithError(ChatRequestEvent event) {
        CompletableFuture<DispatchResult> future = event.getResultFuture();
        if (future == null) {
            return;
        }

        ErrorKind errorKind = event.getErrorKind() != null ? event.getErrorKind() : ErrorKind.INTERNAL_ERROR;
        String requestId = event.getRequest() != null ? event.getRequest().requestId() : "unknown";

        log.debug("Completing request with pre-dispatch error: requestId={}, errorKind={}, error={}",
                requestId, errorKind, event.getErrorMessage());

        complete(future, DispatchResult.rejected(errorKind, event.getErrorMessage()));
    }

    private static void complete(CompletableFuture<DispatchResult> future, DispatchResult result) {
        // The caller may have given up already; its reply must not leak
        if (!future.complete(result)) {
            result.discard();
        }
    }
}
