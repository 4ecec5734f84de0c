package fr.lapetina.chatgateway.domain.event;

import fr.lapetina.chatgateway.dispatch.DispatchResult;
import fr.lapetina.chatgateway.domain.model.ChatRequest;
import fr.lapetina.chatgateway.domain.model.ErrorKind;
import fr.lapetina.chatgateway.domain.model.RequestEnvelope;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * A mutable holder reused across the ring buffer. Each handler stage updates
 * the event as it progresses through the pipeline. Nothing outside the
 * pipeline handlers may keep a reference to it: the dispatch stage copies
 * what the dispatch worker needs before handing off.
 */
public final class ChatRequestEvent {

    private ChatRequest request;
    private RequestEnvelope envelope;

    private EventState state;
    private ErrorKind errorKind;
    private String errorMessage;

    // Timing
    private Instant acceptedAt;
    private Instant validatedAt;
    private Instant translatedAt;
    private Instant dispatchedAt;

    private CompletableFuture<DispatchResult> resultFuture;

    // Sequence number (set by Disruptor)
    private long sequence;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.request = null;
        this.envelope = null;
        this.state = null;
        this.errorKind = null;
        this.errorMessage = null;
        this.acceptedAt = null;
        this.validatedAt = null;
        this.translatedAt = null;
        this.dispatchedAt = null;
        this.resultFuture = null;
        this.sequence = -1;
    }

    /**
     * Initializes the event with a new request.
     */
    public void initialize(ChatRequest request, CompletableFuture<DispatchResult> resultFuture) {
        clear();
        this.request = request;
        this.resultFuture = resultFuture;
        this.state = EventState.CREATED;
        this.acceptedAt = Instant.now();
    }

    public ChatRequest getRequest() {
        return request;
    }

    public RequestEnvelope getEnvelope() {
        return envelope;
    }

    public EventState getState() {
        return state;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    public Instant getValidatedAt() {
        return validatedAt;
    }

    public Instant getTranslatedAt() {
        return translatedAt;
    }

    public Instant getDispatchedAt() {
        return dispatchedAt;
    }

    public CompletableFuture<DispatchResult> getResultFuture() {
        return resultFuture;
    }

    public long getSequence() {
        return sequence;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public void markValidated() {
        this.state = EventState.VALIDATED;
        this.validatedAt = Instant.now();
    }

    public void markValidationFailed(ErrorKind errorKind, String message) {
        this.state = EventState.VALIDATION_FAILED;
        this.errorKind = errorKind;
        this.errorMessage = message;
    }

    public void markTranslated(RequestEnvelope envelope) {
        this.envelope = envelope;
        this.state = EventState.TRANSLATED;
        this.translatedAt = Instant.now();
    }

    public void markTranslationFailed(ErrorKind errorKind, String message) {
        this.state = EventState.TRANSLATION_FAILED;
        this.errorKind = errorKind;
        this.errorMessage = message;
    }

    public void markDispatched() {
        this.state = EventState.DISPATCHED;
        this.dispatchedAt = Instant.now();
    }

    public void markFailed(ErrorKind errorKind, String message) {
        this.state = EventState.FAILED;
        this.errorKind = errorKind;
        this.errorMessage = message;
    }

    /**
     * Checks if the pipeline is done with this request.
     */
    public boolean isTerminal() {
        return state == EventState.DISPATCHED || state == EventState.FAILED;
    }

    /**
     * Checks if processing should skip remaining handlers.
     */
    public boolean shouldSkip() {
        return state == EventState.VALIDATION_FAILED
            || state == EventState.TRANSLATION_FAILED
            || isTerminal();
    }

    @Override
    public String toString() {
        return "ChatRequestEvent{" +
                "requestId=" + (request != null ? request.requestId() : "null") +
                ", model=" + (request != null ? request.model() : "null") +
                ", state=" + state +
                ", error=" + errorKind +
                ", seq=" + sequence +
                '}';
    }
}
