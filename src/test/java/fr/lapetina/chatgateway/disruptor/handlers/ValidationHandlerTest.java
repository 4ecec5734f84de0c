package fr.lapetina.chatgateway.disruptor.handlers;

import fr.lapetina.chatgateway.domain.event.ChatRequestEvent;
import fr.lapetina.chatgateway.domain.event.EventState;
import fr.lapetina.chatgateway.domain.model.ChatRequest;
import fr.lapetina.chatgateway.domain.model.ChatRequest.Message;
import fr.lapetina.chatgateway.domain.model.ErrorKind;
import fr.lapetina.chatgateway.domain.translate.ModelCatalog;
import fr.lapetina.chatgateway.domain.translate.RequestTranslator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationHandlerTest {

    private ValidationHandler handler;
    private ChatRequestEvent event;

    @BeforeEach
    void setUp() {
        handler = new ValidationHandler(10000);
        event = new ChatRequestEvent();
    }

    private void submit(ChatRequest request) {
        event.initialize(request, new CompletableFuture<>());
        handler.onEvent(event, 0, true);
    }

    @Test
    @DisplayName("should validate a well-formed conversation")
    void shouldValidateConversation() {
        submit(ChatRequest.of("gemini-2.5-flash", List.of(
                new Message("system", "Be terse."),
                new Message("user", "Hello!"),
                new Message("assistant", "Hi there!")
        ), false));

        assertThat(event.getState()).isEqualTo(EventState.VALIDATED);
        assertThat(event.getErrorKind()).isNull();
        assertThat(event.getValidatedAt()).isNotNull();
    }

    @Test
    @DisplayName("should reject a null request")
    void shouldRejectNullRequest() {
        submit(null);

        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
        assertThat(event.getErrorKind()).isEqualTo(ErrorKind.MALFORMED_REQUEST);
    }

    @Test
    @DisplayName("should reject a missing model")
    void shouldRejectMissingModel() {
        submit(ChatRequest.of(" ", List.of(new Message("user", "Hi")), false));

        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
        assertThat(event.getErrorMessage()).contains("Model");
    }

    @Test
    @DisplayName("should reject an empty message list")
    void shouldRejectNoMessages() {
        submit(ChatRequest.of("gemini-2.5-flash", List.of(), false));

        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
        assertThat(event.getErrorMessage()).contains("message");
    }

    @Test
    @DisplayName("should reject an unknown role")
    void shouldRejectUnknownRole() {
        submit(ChatRequest.of("gemini-2.5-flash", List.of(new Message("tool", "{}")), false));

        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
        assertThat(event.getErrorMessage()).contains("tool");
    }

    @Test
    @DisplayName("should reject a message without role or content")
    void shouldRejectIncompleteMessage() {
        submit(ChatRequest.of("gemini-2.5-flash", List.of(new Message(null, null)), false));
        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);

        submit(ChatRequest.of("gemini-2.5-flash", List.of(new Message("user", null)), false));
        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
        assertThat(event.getErrorMessage()).contains("content");
    }

    @Test
    @DisplayName("should reject a conversation exceeding max length")
    void shouldRejectLongPrompt() {
        handler = new ValidationHandler(10);

        submit(ChatRequest.of("gemini-2.5-flash", List.of(
                new Message("user", "123456"),
                new Message("user", "789012")
        ), false));

        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
        assertThat(event.getErrorMessage()).contains("maximum length");
    }

    @Test
    @DisplayName("should skip events already failed")
    void shouldSkipFailedEvents() {
        event.initialize(ChatRequest.of("gemini-2.5-flash", List.of(new Message("user", "Hi")), false),
                new CompletableFuture<>());
        event.markFailed(ErrorKind.INTERNAL_ERROR, "earlier failure");

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.FAILED);
    }

    @Nested
    @DisplayName("TranslationHandler")
    class TranslationTests {

        private final TranslationHandler translation =
                new TranslationHandler(new RequestTranslator(ModelCatalog.defaults()));

        @Test
        @DisplayName("should attach the envelope to a validated event")
        void shouldTranslateValidatedEvent() {
            submit(ChatRequest.of("gemini-2.5-flash", List.of(new Message("user", "Hi")), true));

            translation.onEvent(event, 0, true);

            assertThat(event.getState()).isEqualTo(EventState.TRANSLATED);
            assertThat(event.getEnvelope().getPrompt()).isEqualTo("User: Hi");
            assertThat(event.getEnvelope().isStream()).isTrue();
        }

        @Test
        @DisplayName("should fail an unknown model before dispatch")
        void shouldFailUnknownModel() {
            submit(ChatRequest.of("gpt-4o", List.of(new Message("user", "Hi")), false));

            translation.onEvent(event, 0, true);

            assertThat(event.getState()).isEqualTo(EventState.TRANSLATION_FAILED);
            assertThat(event.getErrorKind()).isEqualTo(ErrorKind.UNKNOWN_MODEL);
            assertThat(event.getEnvelope()).isNull();
        }

        @Test
        @DisplayName("should leave events that failed validation untouched")
        void shouldSkipInvalidEvents() {
            submit(ChatRequest.of("gemini-2.5-flash", List.of(), false));

            translation.onEvent(event, 0, true);

            assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
        }
    }
}
