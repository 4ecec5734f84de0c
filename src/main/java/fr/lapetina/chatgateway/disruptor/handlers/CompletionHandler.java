package fr.lapetina.chatgateway.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.chatgateway.domain.event.ChatRequestEvent;
import fr.lapetina.chatgateway.domain.event.EventState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Final stage handler: logs the intake summary and clears the event for reuse.
 */
public final class CompletionHandler implements EventHandler<ChatRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    @Override
    public void onEvent(ChatRequestEvent event, long sequence, boolean endOfBatch) {
        try {
            logIntakeSummary(event);
        } finally {
            event.clear();
        }
    }

    private void logIntakeSummary(ChatRequestEvent event) {
        if (event.getRequest() == null) {
            return;
        }

        String requestId = event.getRequest().requestId();
        String model = event.getRequest().model();
        long intakeMs = event.getAcceptedAt() != null
                ? Duration.between(event.getAcceptedAt(), Instant.now()).toMillis()
                : 0;

        if (event.getState() == EventState.DISPATCHED) {
            log.debug("Request handed to dispatcher: requestId={}, model={}, intakeMs={}",
                    requestId, model, intakeMs);
        } else {
            log.info("Request rejected: requestId={}, model={}, state={}, errorKind={}, errorMessage={}",
                    requestId, model, event.getState(), event.getErrorKind(), event.getErrorMessage());
        }
    }
}
