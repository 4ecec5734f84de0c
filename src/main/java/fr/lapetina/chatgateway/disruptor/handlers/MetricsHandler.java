package fr.lapetina.chatgateway.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.chatgateway.domain.event.ChatRequestEvent;
import fr.lapetina.chatgateway.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;

/**
 * Fourth stage handler: records intake metrics.
 *
 * Records:
 * - Stage timings (validation, translation, queue)
 * - Requests rejected before dispatch, by error kind
 *
 * Dispatch outcomes are recorded by the dispatch worker once they are known.
 */
public final class MetricsHandler implements EventHandler<ChatRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(ChatRequestEvent event, long sequence, boolean endOfBatch) {
        setupMDC(event);

        try {
            recordMetrics(event);
        } finally {
            clearMDC();
        }
    }

    private void setupMDC(ChatRequestEvent event) {
        if (event.getRequest() != null) {
            MDC.put("requestId", event.getRequest().requestId());
            MDC.put("model", String.valueOf(event.getRequest().model()));
        }
        MDC.put("eventState", event.getState() != null ? event.getState().name() : "UNKNOWN");
    }

    private void clearMDC() {
        MDC.remove("requestId");
        MDC.remove("model");
        MDC.remove("eventState");
    }

    private void recordMetrics(ChatRequestEvent event) {
        String model = event.getRequest() != null && event.getRequest().model() != null
                ? event.getRequest().model()
                : "unknown";

        if (event.getValidatedAt() != null && event.getAcceptedAt() != null) {
            metricsRegistry.recordStageLatency("validation",
                    Duration.between(event.getAcceptedAt(), event.getValidatedAt()));
        }

        if (event.getTranslatedAt() != null && event.getValidatedAt() != null) {
            metricsRegistry.recordStageLatency("translation",
                    Duration.between(event.getValidatedAt(), event.getTranslatedAt()));
        }

        if (event.getDispatchedAt() != null && event.getTranslatedAt() != null) {
            metricsRegistry.recordStageLatency("queue",
                    Duration.between(event.getTranslatedAt(), event.getDispatchedAt()));
        }

        // Dispatched requests are counted by the worker when their outcome is known
        if (event.getDispatchedAt() == null && event.getErrorKind() != null) {
            metricsRegistry.incrementRequestCount(model, "rejected");
            metricsRegistry.incrementErrorCount(model, event.getErrorKind());

            log.debug("Request rejection recorded: model={}, errorKind={}, message={}",
                    model, event.getErrorKind(), event.getErrorMessage());
        }
    }
}
