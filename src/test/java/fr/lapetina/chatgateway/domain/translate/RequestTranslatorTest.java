package fr.lapetina.chatgateway.domain.translate;

import fr.lapetina.chatgateway.domain.model.ChatRequest;
import fr.lapetina.chatgateway.domain.model.ChatRequest.Message;
import fr.lapetina.chatgateway.domain.model.ModelDescriptor;
import fr.lapetina.chatgateway.domain.model.RequestEnvelope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestTranslatorTest {

    private final RequestTranslator translator = new RequestTranslator(ModelCatalog.defaults());

    @Nested
    @DisplayName("Prompt flattening")
    class FlattenTests {

        @Test
        @DisplayName("should label each message and separate blocks with a blank line")
        void shouldFlattenConversation() {
            String prompt = RequestTranslator.flatten(List.of(
                    new Message("system", "Be terse."),
                    new Message("user", "Hi"),
                    new Message("assistant", "Hello."),
                    new Message("user", "Bye")
            ));

            assertThat(prompt).isEqualTo("System: Be terse.\n\nUser: Hi\n\nAssistant: Hello.\n\nUser: Bye");
        }

        @Test
        @DisplayName("should keep multi-line content untouched")
        void shouldKeepMultilineContent() {
            String prompt = RequestTranslator.flatten(List.of(new Message("user", "line 1\nline 2")));

            assertThat(prompt).isEqualTo("User: line 1\nline 2");
        }

        @Test
        @DisplayName("should accept roles in any case")
        void shouldAcceptRoleCase() {
            assertThat(RequestTranslator.flatten(List.of(new Message("USER", "x")))).isEqualTo("User: x");
        }

        @Test
        @DisplayName("should reject an unknown role")
        void shouldRejectUnknownRole() {
            assertThatThrownBy(() -> RequestTranslator.flatten(List.of(new Message("tool", "x"))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("tool");
        }
    }

    @Nested
    @DisplayName("Translation")
    class TranslateTests {

        @Test
        @DisplayName("should resolve the model and carry the request fields")
        void shouldTranslate() {
            ChatRequest request = ChatRequest.builder()
                    .requestId("chatcmpl-123")
                    .model("gemini-2.5-pro")
                    .messages(List.of(new Message("user", "Hi")))
                    .stream(true)
                    .build();

            RequestEnvelope envelope = translator.translate(request);

            assertThat(envelope.getRequestId()).isEqualTo("chatcmpl-123");
            assertThat(envelope.getPrompt()).isEqualTo("User: Hi");
            assertThat(envelope.getModelAlias()).isEqualTo("gemini-2.5-pro");
            assertThat(envelope.getUpstreamModel()).isEqualTo("gemini-2.5-pro");
            assertThat(envelope.isStream()).isTrue();
            assertThat(envelope.getCreatedAt()).isEqualTo(request.createdAt());
            assertThat(envelope.getExcluded()).isEmpty();
        }

        @Test
        @DisplayName("should map an alias to its upstream id")
        void shouldMapAlias() {
            RequestTranslator custom = new RequestTranslator(new ModelCatalog(List.of(
                    new ModelDescriptor("fast", "gemini-2.5-flash", null, false))));

            RequestEnvelope envelope = custom.translate(ChatRequest.of("fast", List.of(new Message("user", "x")), false));

            assertThat(envelope.getModelAlias()).isEqualTo("fast");
            assertThat(envelope.getUpstreamModel()).isEqualTo("gemini-2.5-flash");
        }

        @Test
        @DisplayName("should reject an unknown model alias")
        void shouldRejectUnknownModel() {
            ChatRequest request = ChatRequest.of("gpt-4", List.of(new Message("user", "Hi")), false);

            assertThatThrownBy(() -> translator.translate(request))
                    .isInstanceOf(UnknownModelException.class)
                    .satisfies(e -> assertThat(((UnknownModelException) e).getAlias()).isEqualTo("gpt-4"));
        }
    }

    @Nested
    @DisplayName("ModelCatalog")
    class CatalogTests {

        @Test
        @DisplayName("should ship the built-in aliases in order")
        void shouldListDefaults() {
            ModelCatalog catalog = ModelCatalog.defaults();

            assertThat(catalog.aliases()).startsWith("gemini-2.5-pro", "gemini-2.5-flash");
            assertThat(catalog.size()).isEqualTo(6);
            assertThat(catalog.find("gemini-2.0-exp-advanced")).get()
                    .extracting(ModelDescriptor::deprecated)
                    .isEqualTo(true);
        }

        @Test
        @DisplayName("should default the tier to standard")
        void shouldDefaultTier() {
            ModelCatalog catalog = new ModelCatalog(List.of(new ModelDescriptor("m", "m", null, false)));

            assertThat(catalog.resolve("m").tier()).isEqualTo("standard");
        }

        @Test
        @DisplayName("should reject duplicate aliases")
        void shouldRejectDuplicates() {
            assertThatThrownBy(() -> new ModelCatalog(List.of(
                    new ModelDescriptor("m", "a", null, false),
                    new ModelDescriptor("m", "b", null, false))))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should treat null as unknown")
        void shouldHandleNullAlias() {
            ModelCatalog catalog = ModelCatalog.defaults();

            assertThat(catalog.contains(null)).isFalse();
            assertThatThrownBy(() -> catalog.resolve(null)).isInstanceOf(UnknownModelException.class);
        }
    }
}
