package fr.lapetina.chatgateway.dispatch;

import fr.lapetina.chatgateway.domain.model.ErrorKind;
import fr.lapetina.chatgateway.infrastructure.upstream.UpstreamReply;

import java.util.List;

/**
 * Final result of a dispatch.
 *
 * On success it carries the credential that answered and its reply; on
 * failure the error kind and message. Both record the attempt count, the
 * credentials tried (in order) and the full state trace.
 */
public record DispatchOutcome(
        DispatchState state,
        String credentialId,
        UpstreamReply reply,
        ErrorKind errorKind,
        String errorMessage,
        int attempts,
        List<String> triedCredentials,
        List<DispatchState> transitions
) {
    public DispatchOutcome {
        triedCredentials = triedCredentials != null ? List.copyOf(triedCredentials) : List.of();
        transitions = transitions != null ? List.copyOf(transitions) : List.of();
    }

    public static DispatchOutcome success(
            String credentialId,
            UpstreamReply reply,
            int attempts,
            List<String> triedCredentials,
            List<DispatchState> transitions
    ) {
        return new DispatchOutcome(DispatchState.SUCCEEDED, credentialId, reply, null, null,
                attempts, triedCredentials, transitions);
    }

    public static DispatchOutcome failure(
            ErrorKind errorKind,
            String errorMessage,
            String lastCredentialId,
            int attempts,
            List<String> triedCredentials,
            List<DispatchState> transitions
    ) {
        return new DispatchOutcome(DispatchState.FAILED, lastCredentialId, null, errorKind, errorMessage,
                attempts, triedCredentials, transitions);
    }

    /**
     * Failure decided before any dispatch started (validation, translation, backpressure).
     */
    public static DispatchOutcome rejected(ErrorKind errorKind, String errorMessage) {
        return failure(errorKind, errorMessage, null, 0, List.of(), List.of());
    }

    public boolean isSuccess() {
        return state == DispatchState.SUCCEEDED;
    }
}
