package fr.lapetina.chatgateway.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.chatgateway.domain.model.OutputEnvelope;
import fr.lapetina.chatgateway.domain.model.TokenUsage;

import java.util.List;

/**
 * Non-streaming chat completion response, in the OpenAI wire format.
 */
public record ChatCompletionResponse(
        String id,
        String object,
        long created,
        String model,
        List<Choice> choices,
        Usage usage
) {

    public static ChatCompletionResponse of(
            String requestId,
            String model,
            long created,
            OutputEnvelope output,
            TokenUsage usage
    ) {
        Choice choice = new Choice(
                0,
                new ChatCompletionRequest.Message("assistant", output.text()),
                output.finishReason() != null ? output.finishReason().getWireValue() : null
        );
        return new ChatCompletionResponse(
                requestId,
                "chat.completion",
                created,
                model,
                List.of(choice),
                new Usage(usage.promptTokens(), usage.completionTokens(), usage.totalTokens())
        );
    }

    public record Choice(
            int index,
            ChatCompletionRequest.Message message,
            @JsonProperty("finish_reason") String finishReason
    ) {
    }

    public record Usage(
            @JsonProperty("prompt_tokens") int promptTokens,
            @JsonProperty("completion_tokens") int completionTokens,
            @JsonProperty("total_tokens") int totalTokens
    ) {
    }
}
