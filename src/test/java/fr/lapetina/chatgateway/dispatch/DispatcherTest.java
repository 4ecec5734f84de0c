package fr.lapetina.chatgateway.dispatch;

import fr.lapetina.chatgateway.domain.model.CredentialSnapshot;
import fr.lapetina.chatgateway.domain.model.ErrorKind;
import fr.lapetina.chatgateway.domain.model.RequestEnvelope;
import fr.lapetina.chatgateway.domain.model.SecretPair;
import fr.lapetina.chatgateway.domain.pool.CredentialPool;
import fr.lapetina.chatgateway.domain.strategy.RoundRobinStrategy;
import fr.lapetina.chatgateway.infrastructure.upstream.ChunkedReply;
import fr.lapetina.chatgateway.infrastructure.upstream.ScriptedSessionAdapter;
import fr.lapetina.chatgateway.infrastructure.upstream.UpstreamException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static fr.lapetina.chatgateway.dispatch.DispatchState.FAILED;
import static fr.lapetina.chatgateway.dispatch.DispatchState.RETRYING;
import static fr.lapetina.chatgateway.dispatch.DispatchState.SELECTING;
import static fr.lapetina.chatgateway.dispatch.DispatchState.SENDING;
import static fr.lapetina.chatgateway.dispatch.DispatchState.SUCCEEDED;
import static org.assertj.core.api.Assertions.assertThat;

class DispatcherTest {

    private CredentialPool pool;
    private ScriptedSessionAdapter adapter;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        pool = CredentialPool.builder()
                .strategy(new RoundRobinStrategy())
                .credential(SecretPair.of("secret-a"), "A")
                .credential(SecretPair.of("secret-b"), "B")
                .credential(SecretPair.of("secret-c"), "C")
                .build();
        adapter = new ScriptedSessionAdapter();
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private Dispatcher dispatcher(int maxAttempts) {
        return new Dispatcher(pool, adapter, executor, Duration.ofSeconds(2), maxAttempts);
    }

    private static RequestEnvelope envelope() {
        return new RequestEnvelope("chatcmpl-test", "User: hi", "gemini-2.5-flash", "gemini-2.5-flash",
                false, Instant.now());
    }

    private CredentialSnapshot snapshot(String id) {
        return pool.status(id).orElseThrow();
    }

    @Nested
    @DisplayName("Success")
    class SuccessTests {

        @Test
        @DisplayName("should succeed on the first credential")
        void shouldSucceedFirstTry() {
            DispatchOutcome outcome = dispatcher(0).dispatch(envelope());

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.credentialId()).isEqualTo("cred-1");
            assertThat(outcome.reply()).isNotNull();
            assertThat(outcome.attempts()).isEqualTo(1);
            assertThat(outcome.transitions()).containsExactly(SELECTING, SENDING, SUCCEEDED);
        }

        @Test
        @DisplayName("should reset the error count of the answering credential")
        void shouldReportSuccess() {
            pool.reportFailure("cred-1");
            pool.reportFailure("cred-1");

            dispatcher(0).dispatch(envelope());

            assertThat(snapshot("cred-1").errorCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Retryable failures")
    class RetryTests {

        @Test
        @DisplayName("should rotate to the next credential after an auth failure")
        void shouldRotateOnAuthExpired() {
            adapter.fail("cred-1", ErrorKind.AUTH_EXPIRED);
            RequestEnvelope envelope = envelope();

            DispatchOutcome outcome = dispatcher(0).dispatch(envelope);

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.credentialId()).isEqualTo("cred-2");
            assertThat(outcome.triedCredentials()).containsExactly("cred-1", "cred-2");
            assertThat(outcome.transitions()).containsExactly(
                    SELECTING, SENDING, RETRYING, SELECTING, SENDING, SUCCEEDED);
            assertThat(envelope.getExcluded()).containsExactly("cred-1");
            assertThat(snapshot("cred-1").errorCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should retry a transient upstream error")
        void shouldRetryTransientUpstreamError() {
            adapter.answer("cred-1", (c, p, m) -> {
                throw UpstreamException.transientError("503 from upstream");
            });

            DispatchOutcome outcome = dispatcher(0).dispatch(envelope());

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.credentialId()).isEqualTo("cred-2");
        }

        @Test
        @DisplayName("should report all credentials exhausted when every one fails")
        void shouldExhaustPool() {
            adapter.answerAll((c, p, m) -> {
                throw new UpstreamException(ErrorKind.RATE_LIMITED, "slow down");
            });

            DispatchOutcome outcome = dispatcher(5).dispatch(envelope());

            assertThat(outcome.isSuccess()).isFalse();
            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.ALL_CREDENTIALS_EXHAUSTED);
            assertThat(outcome.attempts()).isEqualTo(3);
            assertThat(outcome.triedCredentials()).containsExactly("cred-1", "cred-2", "cred-3");
            assertThat(outcome.transitions()).endsWith(RETRYING, SELECTING, FAILED);
            assertThat(pool.status()).allMatch(s -> s.errorCount() == 1);
        }

        @Test
        @DisplayName("should stop at the attempt bound")
        void shouldStopAtBound() {
            adapter.answerAll((c, p, m) -> {
                throw new UpstreamException(ErrorKind.NETWORK_ERROR, "connection reset");
            });

            DispatchOutcome outcome = dispatcher(2).dispatch(envelope());

            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.RETRIES_EXHAUSTED);
            assertThat(outcome.attempts()).isEqualTo(2);
            assertThat(adapter.getCalls()).containsExactly("cred-1", "cred-2");
            assertThat(snapshot("cred-3").errorCount()).isZero();
        }

        @Test
        @DisplayName("should bound attempts by the pool size by default")
        void shouldDefaultBoundToPoolSize() {
            assertThat(dispatcher(0).effectiveMaxAttempts()).isEqualTo(3);
            assertThat(dispatcher(7).effectiveMaxAttempts()).isEqualTo(7);
        }

        @Test
        @DisplayName("should treat a send timeout as a network error and move on")
        void shouldRotateOnTimeout() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            adapter.answer("cred-1", (c, p, m) -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return ChunkedReply.ofText("too late");
            });
            Dispatcher dispatcher = new Dispatcher(pool, adapter, executor, Duration.ofMillis(100), 0);

            DispatchOutcome outcome = dispatcher.dispatch(envelope());
            release.countDown();

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.credentialId()).isEqualTo("cred-2");
            assertThat(snapshot("cred-1").errorCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Fatal failures")
    class FatalTests {

        @Test
        @DisplayName("should fail without touching credential state on a malformed request")
        void shouldFailFastOnMalformedRequest() {
            adapter.fail("cred-1", ErrorKind.MALFORMED_REQUEST);
            List<CredentialSnapshot> before = pool.status();

            DispatchOutcome outcome = dispatcher(0).dispatch(envelope());

            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.MALFORMED_REQUEST);
            assertThat(outcome.attempts()).isEqualTo(1);
            assertThat(outcome.transitions()).containsExactly(SELECTING, SENDING, FAILED);
            assertThat(snapshot("cred-1").errorCount()).isEqualTo(before.get(0).errorCount());
            assertThat(snapshot("cred-1").available()).isTrue();
        }

        @Test
        @DisplayName("should not retry a non-transient upstream error")
        void shouldNotRetryPermanentUpstreamError() {
            adapter.fail("cred-1", ErrorKind.UPSTREAM_ERROR);

            DispatchOutcome outcome = dispatcher(0).dispatch(envelope());

            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.UPSTREAM_ERROR);
            assertThat(adapter.getCalls()).containsExactly("cred-1");
            assertThat(snapshot("cred-1").errorCount()).isZero();
        }

        @Test
        @DisplayName("should map an adapter bug to an internal error")
        void shouldMapRuntimeException() {
            adapter.answer("cred-1", (c, p, m) -> {
                throw new IllegalStateException("boom");
            });

            DispatchOutcome outcome = dispatcher(0).dispatch(envelope());

            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.INTERNAL_ERROR);
            assertThat(snapshot("cred-1").errorCount()).isZero();
        }

        @Test
        @DisplayName("should fail immediately when no credential is available")
        void shouldFailWhenNothingAvailable() {
            for (String id : List.of("cred-1", "cred-2", "cred-3")) {
                for (int i = 0; i < 3; i++) {
                    pool.reportFailure(id);
                }
            }

            DispatchOutcome outcome = dispatcher(0).dispatch(envelope());

            assertThat(outcome.errorKind()).isEqualTo(ErrorKind.ALL_CREDENTIALS_EXHAUSTED);
            assertThat(outcome.attempts()).isZero();
            assertThat(outcome.transitions()).containsExactly(SELECTING, FAILED);
            assertThat(adapter.getCalls()).isEmpty();
        }
    }
}
