package fr.lapetina.chatgateway.domain.model;

/**
 * One discrete unit of output for the client.
 *
 * A streaming response is a run of delta envelopes followed by exactly one
 * terminal envelope (finish reason set). A non-streaming response is a single
 * terminal envelope whose text is the whole body.
 */
public record OutputEnvelope(
        long sequence,
        String text,
        FinishReason finishReason,
        ErrorKind errorKind,
        String errorMessage
) {
    public OutputEnvelope {
        text = text != null ? text : "";
    }

    public static OutputEnvelope delta(long sequence, String text) {
        return new OutputEnvelope(sequence, text, null, null, null);
    }

    public static OutputEnvelope finished(long sequence, String text) {
        return new OutputEnvelope(sequence, text, FinishReason.STOP, null, null);
    }

    public static OutputEnvelope failed(long sequence, String text, ErrorKind errorKind, String errorMessage) {
        return new OutputEnvelope(sequence, text, FinishReason.ERROR, errorKind, errorMessage);
    }

    public boolean isTerminal() {
        return finishReason != null;
    }

    public boolean isError() {
        return finishReason == FinishReason.ERROR;
    }
}
