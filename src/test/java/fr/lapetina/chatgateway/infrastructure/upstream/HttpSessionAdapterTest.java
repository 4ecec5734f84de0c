package fr.lapetina.chatgateway.infrastructure.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.chatgateway.domain.model.ErrorKind;
import fr.lapetina.chatgateway.domain.model.SecretPair;
import fr.lapetina.chatgateway.domain.pool.CredentialPool;
import fr.lapetina.chatgateway.domain.pool.CredentialRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpSessionAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<String> lastCookie = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();

    private HttpServer upstream;
    private boolean upstreamStopped;
    private volatile int status = 200;
    private volatile String body = "{\"text\":\"Hello there world\"}";
    private HttpSessionAdapter adapter;
    private CredentialRecord credential;

    @BeforeEach
    void setUp() throws Exception {
        upstream = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        upstream.createContext("/generate", exchange -> {
            lastCookie.set(exchange.getRequestHeaders().getFirst("Cookie"));
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        upstream.start();

        adapter = new HttpSessionAdapter(
                URI.create("http://127.0.0.1:" + upstream.getAddress().getPort() + "/generate"),
                "SID",
                "SIDTS",
                Duration.ofSeconds(2),
                Duration.ofSeconds(5)
        );
        credential = CredentialPool.builder()
                .credential(new SecretPair("primary-token", "secondary-token"))
                .build()
                .select(Set.of());
    }

    @AfterEach
    void tearDown() {
        if (!upstreamStopped) {
            upstream.stop(0);
        }
    }

    private String readAll(UpstreamReply reply) throws UpstreamException {
        StringBuilder text = new StringBuilder();
        Optional<String> delta;
        while ((delta = reply.nextDelta()).isPresent()) {
            text.append(delta.get());
        }
        return text.toString();
    }

    @Nested
    @DisplayName("Successful replies")
    class SuccessTests {

        @Test
        @DisplayName("should send model, prompt and both cookies")
        void shouldSendRequest() throws Exception {
            adapter.send(credential, "User: Hi", "gemini-2.5-pro");

            JsonNode sent = objectMapper.readTree(lastBody.get());
            assertThat(sent.get("model").asText()).isEqualTo("gemini-2.5-pro");
            assertThat(sent.get("prompt").asText()).isEqualTo("User: Hi");
            assertThat(lastCookie.get()).isEqualTo("SID=primary-token; SIDTS=secondary-token");
        }

        @Test
        @DisplayName("should stream the reply text as word chunks")
        void shouldChunkReply() throws Exception {
            UpstreamReply reply = adapter.send(credential, "User: Hi", "gemini-2.5-pro");

            assertThat(reply.nextDelta()).contains("Hello ");
            assertThat(readAll(reply)).isEqualTo("there world");
        }

        @Test
        @DisplayName("should fail on a reply without text")
        void shouldRejectMissingText() {
            body = "{\"answer\":\"x\"}";

            assertThatThrownBy(() -> adapter.send(credential, "User: Hi", "gemini-2.5-pro"))
                    .isInstanceOf(UpstreamException.class)
                    .satisfies(e -> assertThat(((UpstreamException) e).getKind()).isEqualTo(ErrorKind.UPSTREAM_ERROR));
        }
    }

    @Nested
    @DisplayName("Failure classification")
    class ClassificationTests {

        @Test
        @DisplayName("should map 401 to a retryable auth failure")
        void shouldMapUnauthorized() {
            status = 401;
            body = "{\"error\":\"cookie expired\"}";

            assertThatThrownBy(() -> adapter.send(credential, "User: Hi", "gemini-2.5-pro"))
                    .isInstanceOf(UpstreamException.class)
                    .hasMessage("cookie expired")
                    .satisfies(e -> {
                        UpstreamException ue = (UpstreamException) e;
                        assertThat(ue.getKind()).isEqualTo(ErrorKind.AUTH_EXPIRED);
                        assertThat(ue.isRetryable()).isTrue();
                    });
        }

        @Test
        @DisplayName("should map status codes to error kinds")
        void shouldClassifyStatusCodes() {
            assertThat(HttpSessionAdapter.classify(403, "x").getKind()).isEqualTo(ErrorKind.AUTH_EXPIRED);
            assertThat(HttpSessionAdapter.classify(429, "x").getKind()).isEqualTo(ErrorKind.RATE_LIMITED);
            assertThat(HttpSessionAdapter.classify(404, "x").getKind()).isEqualTo(ErrorKind.UNKNOWN_MODEL);
            assertThat(HttpSessionAdapter.classify(400, "x").getKind()).isEqualTo(ErrorKind.MALFORMED_REQUEST);
            assertThat(HttpSessionAdapter.classify(400, "x").isRetryable()).isFalse();
        }

        @Test
        @DisplayName("should treat 5xx as a transient upstream error")
        void shouldTreatServerErrorsAsTransient() {
            UpstreamException e = HttpSessionAdapter.classify(503, "overloaded");

            assertThat(e.getKind()).isEqualTo(ErrorKind.UPSTREAM_ERROR);
            assertThat(e.isTransient()).isTrue();
            assertThat(e.isRetryable()).isTrue();
        }

        @Test
        @DisplayName("should map an unreachable upstream to a network error")
        void shouldMapConnectionFailure() {
            upstream.stop(0);
            upstreamStopped = true;

            assertThatThrownBy(() -> adapter.send(credential, "User: Hi", "gemini-2.5-pro"))
                    .isInstanceOf(UpstreamException.class)
                    .satisfies(e -> assertThat(((UpstreamException) e).getKind()).isEqualTo(ErrorKind.NETWORK_ERROR));
        }
    }

    @Nested
    @DisplayName("TextChunker")
    class ChunkerTests {

        @Test
        @DisplayName("should keep whitespace so chunks concatenate to the text")
        void shouldPreserveText() {
            String text = "  Leading and\ttabs\n\nnew lines ";

            assertThat(String.join("", TextChunker.chunk(text))).isEqualTo(text);
        }

        @Test
        @DisplayName("should attach whitespace to the preceding word")
        void shouldSplitOnWords() {
            assertThat(TextChunker.chunk("one two  three")).containsExactly("one ", "two  ", "three");
        }

        @Test
        @DisplayName("should yield nothing for empty text")
        void shouldHandleEmpty() {
            assertThat(TextChunker.chunk("")).isEmpty();
            assertThat(TextChunker.chunk(null)).isEmpty();
        }
    }
}
