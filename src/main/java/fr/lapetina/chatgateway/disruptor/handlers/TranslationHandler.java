package fr.lapetina.chatgateway.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.chatgateway.domain.event.ChatRequestEvent;
import fr.lapetina.chatgateway.domain.event.EventState;
import fr.lapetina.chatgateway.domain.model.ErrorKind;
import fr.lapetina.chatgateway.domain.model.RequestEnvelope;
import fr.lapetina.chatgateway.domain.translate.RequestTranslator;
import fr.lapetina.chatgateway.domain.translate.UnknownModelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Second stage handler: resolves the model alias and flattens the messages
 * into the upstream prompt.
 *
 * An unknown model fails here, before any credential is selected.
 */
public final class TranslationHandler implements EventHandler<ChatRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(TranslationHandler.class);

    private final RequestTranslator translator;

    public TranslationHandler(RequestTranslator translator) {
        this.translator = translator;
    }

    @Override
    public void onEvent(ChatRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            return;
        }

        if (event.getState() != EventState.VALIDATED) {
            event.markTranslationFailed(ErrorKind.INTERNAL_ERROR, "Invalid state for translation: " + event.getState());
            return;
        }

        String requestId = event.getRequest().requestId();
        try {
            RequestEnvelope envelope = translator.translate(event.getRequest());
            event.markTranslated(envelope);

            log.debug("Request translated: requestId={}, model={}, upstreamModel={}, promptLength={}",
                    requestId, envelope.getModelAlias(), envelope.getUpstreamModel(), envelope.getPrompt().length());

        } catch (UnknownModelException e) {
            event.markTranslationFailed(ErrorKind.UNKNOWN_MODEL, e.getMessage());
            log.warn("Unknown model: requestId={}, model={}", requestId, e.getAlias());

        } catch (IllegalArgumentException e) {
            event.markTranslationFailed(ErrorKind.MALFORMED_REQUEST, e.getMessage());
            log.warn("Translation failed: requestId={}, reason={}", requestId, e.getMessage());
        }
    }
}
