package fr.lapetina.chatgateway.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.chatgateway.domain.model.ChatRequest;
import fr.lapetina.chatgateway.domain.model.ErrorKind;
import fr.lapetina.chatgateway.domain.model.OutputEnvelope;
import fr.lapetina.chatgateway.domain.model.TokenUsage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WireFormatTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("should accept and ignore sampling parameters")
    void shouldParseRequest() throws Exception {
        ChatCompletionRequest body = objectMapper.readValue("""
                {"model": "gemini-2.5-pro", "stream": true, "temperature": 0.7, "max_tokens": 64,
                 "top_p": 0.9, "n": 1, "messages": [{"role": "user", "content": "Hi", "name": "bob"}]}
                """, ChatCompletionRequest.class);

        ChatRequest request = body.toChatRequest();

        assertThat(body.getMaxTokens()).isEqualTo(64);
        assertThat(request.model()).isEqualTo("gemini-2.5-pro");
        assertThat(request.stream()).isTrue();
        assertThat(request.messages()).containsExactly(new ChatRequest.Message("user", "Hi"));
        assertThat(request.requestId()).startsWith("chatcmpl-");
    }

    @Test
    @DisplayName("should keep null messages for validation to reject")
    void shouldKeepNullMessages() throws Exception {
        ChatCompletionRequest body = objectMapper.readValue(
                "{\"model\": \"m\", \"messages\": [null]}", ChatCompletionRequest.class);

        assertThat(body.toChatRequest().messages()).containsExactly(new ChatRequest.Message(null, null));
    }

    @Test
    @DisplayName("should render an error chunk with kind and message")
    void shouldRenderErrorChunk() {
        ChatCompletionChunk chunk = ChatCompletionChunk.of("chatcmpl-1", "m", 1L,
                OutputEnvelope.failed(3, "", ErrorKind.RATE_LIMITED, "quota"));
        JsonNode json = objectMapper.valueToTree(chunk);

        assertThat(json.get("choices").get(0).get("finish_reason").asText()).isEqualTo("error");
        assertThat(json.get("error").get("kind").asText()).isEqualTo("RATE_LIMITED");
        assertThat(json.get("error").get("message").asText()).isEqualTo("quota");
    }

    @Test
    @DisplayName("should omit the error field from regular chunks")
    void shouldOmitErrorFromDeltas() {
        JsonNode json = objectMapper.valueToTree(
                ChatCompletionChunk.of("chatcmpl-1", "m", 1L, OutputEnvelope.delta(0, "Hi")));

        assertThat(json.has("error")).isFalse();
        assertThat(json.get("choices").get(0).get("delta").get("content").asText()).isEqualTo("Hi");
    }

    @Test
    @DisplayName("should estimate usage from word counts")
    void shouldEstimateUsage() {
        TokenUsage usage = TokenUsage.estimate("User: what is  this?\n", "  ");

        assertThat(usage.promptTokens()).isEqualTo(4);
        assertThat(usage.completionTokens()).isZero();
        assertThat(usage.totalTokens()).isEqualTo(4);
    }
}
