package fr.lapetina.chatgateway.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.chatgateway.domain.event.ChatRequestEvent;
import fr.lapetina.chatgateway.domain.model.ChatRequest;
import fr.lapetina.chatgateway.domain.model.ChatRole;
import fr.lapetina.chatgateway.domain.model.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First stage handler: validates the structure of incoming chat requests.
 *
 * Validates:
 * - Request is not null
 * - Model name is present
 * - At least one message, each with a known role and non-null content
 * - Total content length is within limits
 *
 * Whether the model exists is the translation stage's concern.
 */
public final class ValidationHandler implements EventHandler<ChatRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(ValidationHandler.class);

    private final int maxPromptLength;

    public ValidationHandler(int maxPromptLength) {
        this.maxPromptLength = maxPromptLength;
    }

    /**
     * Creates a handler with the default prompt length.
     */
    public static ValidationHandler withDefaults() {
        return new ValidationHandler(100_000);
    }

    @Override
    public void onEvent(ChatRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            log.debug("Skipping already processed event: sequence={}", sequence);
            return;
        }

        event.setSequence(sequence);
        ChatRequest request = event.getRequest();

        try {
            validate(request);
            event.markValidated();

            log.debug("Request validated: requestId={}, model={}, messages={}, sequence={}",
                    request.requestId(), request.model(), request.messages().size(), sequence);

        } catch (ValidationException e) {
            event.markValidationFailed(ErrorKind.MALFORMED_REQUEST, e.getMessage());

            log.warn("Validation failed: requestId={}, model={}, reason={}, sequence={}",
                    request != null ? request.requestId() : "null",
                    request != null ? request.model() : "null",
                    e.getMessage(),
                    sequence);
        }
    }

    private void validate(ChatRequest request) throws ValidationException {
        if (request == null) {
            throw new ValidationException("Request is null");
        }

        String model = request.model();
        if (model == null || model.isBlank()) {
            throw new ValidationException("Model name is required");
        }

        if (request.messages().isEmpty()) {
            throw new ValidationException("At least one message is required");
        }

        long totalLength = 0;
        for (ChatRequest.Message message : request.messages()) {
            if (message == null) {
                throw new ValidationException("Message must not be null");
            }
            if (message.role() == null || message.role().isBlank()) {
                throw new ValidationException("Message role is required");
            }
            if (ChatRole.fromWire(message.role()).isEmpty()) {
                throw new ValidationException("Unknown message role: " + message.role());
            }
            if (message.content() == null) {
                throw new ValidationException("Message content is required");
            }
            totalLength += message.content().length();
        }

        if (totalLength > maxPromptLength) {
            throw new ValidationException("Prompt exceeds maximum length of " + maxPromptLength);
        }
    }

    private static class ValidationException extends Exception {
        ValidationException(String message) {
            super(message);
        }
    }
}
