package fr.lapetina.chatgateway.dispatch;

/**
 * States of one dispatch, from credential selection to a final outcome.
 *
 * <pre>
 * SELECTING -> SENDING -> SUCCEEDED
 *                      -> RETRYING -> SELECTING
 *                      -> FAILED
 * SELECTING -> FAILED (no eligible credential)
 * </pre>
 */
public enum DispatchState {
    SELECTING,
    SENDING,
    RETRYING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
