package fr.lapetina.chatgateway.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.chatgateway.domain.model.OutputEnvelope;

import java.util.List;

/**
 * One server-sent event of a streaming chat completion.
 *
 * Delta envelopes become chunks with content and no finish reason; the
 * terminal envelope becomes a chunk with an empty delta and the finish
 * reason. An error terminal also carries the error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatCompletionChunk(
        String id,
        String object,
        long created,
        String model,
        List<Choice> choices,
        ErrorResponse.ErrorBody error
) {

    public static ChatCompletionChunk of(String requestId, String model, long created, OutputEnvelope envelope) {
        Delta delta = envelope.isTerminal() && envelope.text().isEmpty()
                ? new Delta(null)
                : new Delta(envelope.text());
        String finishReason = envelope.finishReason() != null ? envelope.finishReason().getWireValue() : null;
        ErrorResponse.ErrorBody error = envelope.isError()
                ? new ErrorResponse.ErrorBody(envelope.errorKind().name(), envelope.errorMessage())
                : null;

        return new ChatCompletionChunk(
                requestId,
                "chat.completion.chunk",
                created,
                model,
                List.of(new Choice(0, delta, finishReason)),
                error
        );
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record Choice(
            int index,
            Delta delta,
            @JsonProperty("finish_reason") String finishReason
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Delta(String content) {
    }
}
