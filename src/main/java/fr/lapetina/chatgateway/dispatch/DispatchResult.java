package fr.lapetina.chatgateway.dispatch;

import fr.lapetina.chatgateway.domain.model.ErrorKind;
import fr.lapetina.chatgateway.domain.model.RequestEnvelope;

/**
 * What the intake pipeline hands back to the caller: the translated request
 * (absent when the request was rejected before translation) and the dispatch outcome.
 */
public record DispatchResult(RequestEnvelope envelope, DispatchOutcome outcome) {

    public static DispatchResult rejected(ErrorKind kind, String message) {
        return new DispatchResult(null, DispatchOutcome.rejected(kind, message));
    }

    public boolean isSuccess() {
        return outcome.isSuccess();
    }

    /**
     * Releases the upstream reply of a successful outcome nobody is going to read.
     */
    public void discard() {
        if (outcome.reply() != null) {
            outcome.reply().cancel();
        }
    }
}
