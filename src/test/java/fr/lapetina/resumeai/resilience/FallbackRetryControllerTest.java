package fr.lapetina.resumeai.resilience;

import fr.lapetina.resumeai.domain.exception.AiServiceException;
import fr.lapetina.resumeai.domain.model.AiRequest;
import fr.lapetina.resumeai.domain.model.AiResponse;
import fr.lapetina.resumeai.domain.model.ErrorCode;
import fr.lapetina.resumeai.domain.model.ProviderHealth;
import fr.lapetina.resumeai.domain.model.RequestKind;
import fr.lapetina.resumeai.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.resumeai.infrastructure.provider.ProviderCallException;
import fr.lapetina.resumeai.infrastructure.provider.ProviderClient;
import fr.lapetina.resumeai.support.StubProviderClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FallbackRetryControllerTest {

    private static final ProviderCallException SERVER_ERROR =
            ProviderCallException.httpStatus("stub", 503, "Service unavailable");

    private StubProviderClient openai;
    private StubProviderClient anthropic;
    private ScheduledExecutorService scheduler;
    private ProviderHealthRegistry health;
    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        openai = new StubProviderClient("openai");
        anthropic = new StubProviderClient("anthropic");
        scheduler = Executors.newSingleThreadScheduledExecutor();
        health = new ProviderHealthRegistry(List.of("openai", "anthropic"), Clock.systemUTC());
        metrics = new MetricsRegistry("test", true);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
        metrics.close();
    }

    private FallbackRetryController.Builder controller() {
        Map<String, ProviderClient> clients = Map.of("openai", openai, "anthropic", anthropic);
        return FallbackRetryController.builder()
                .clients(clients)
                .providerOrder(List.of("openai", "anthropic"))
                .classifier(new ErrorClassifier())
                .backoff(new BackoffPolicy(Duration.ofMillis(1), Duration.ofMillis(4)))
                .retryAttempts(2)
                .scheduler(scheduler)
                .health(health)
                .metrics(metrics);
    }

    private static AiRequest request() {
        return AiRequest.of(RequestKind.CONTENT_GENERATION, "user-1", "Write a summary");
    }

    private static AiServiceException failureOf(CompletableFuture<AiResponse> future) {
        Throwable thrown = null;
        try {
            future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            thrown = e.getCause();
        } catch (Exception e) {
            throw new AssertionError("Unexpected failure", e);
        }
        assertThat(thrown).isInstanceOf(AiServiceException.class);
        return (AiServiceException) thrown;
    }

    @Nested
    @DisplayName("Retry on the same provider")
    class Retry {

        @Test
        @DisplayName("should succeed on first attempt")
        void shouldSucceedOnFirstAttempt() throws Exception {
            AiResponse response = controller().build().execute(request(), "openai").get(5, TimeUnit.SECONDS);

            assertThat(response.provider()).isEqualTo("openai");
            assertThat(response.attempts()).isEqualTo(1);
            assertThat(openai.callCount()).isEqualTo(1);
            assertThat(anthropic.callCount()).isZero();
        }

        @Test
        @DisplayName("should retry a transient failure on the same provider")
        void shouldRetryTransientFailure() throws Exception {
            openai.thenFail(SERVER_ERROR);

            AiResponse response = controller().build().execute(request(), "openai").get(5, TimeUnit.SECONDS);

            assertThat(response.provider()).isEqualTo("openai");
            assertThat(response.attempts()).isEqualTo(2);
            assertThat(openai.callCount()).isEqualTo(2);
            assertThat(anthropic.callCount()).isZero();
        }

        @Test
        @DisplayName("should not retry authentication errors or fall back")
        void shouldNotRetryAuthenticationErrors() {
            openai.alwaysFail(ProviderCallException.httpStatus("openai", 401, "Invalid API key"));

            AiServiceException failure = failureOf(controller().build().execute(request(), "openai"));

            assertThat(failure.getCode()).isEqualTo(ErrorCode.AUTHENTICATION_ERROR);
            assertThat(failure.isRetryable()).isFalse();
            assertThat(openai.callCount()).isEqualTo(1);
            assertThat(anthropic.callCount()).isZero();
        }

        @Test
        @DisplayName("should not retry invalid requests or fall back")
        void shouldNotRetryInvalidRequests() {
            openai.alwaysFail(ProviderCallException.httpStatus("openai", 400, "max_tokens too large"));

            AiServiceException failure = failureOf(controller().build().execute(request(), "openai"));

            assertThat(failure.getCode()).isEqualTo(ErrorCode.INVALID_REQUEST);
            assertThat(failure.getMessage()).isEqualTo("max_tokens too large");
            assertThat(openai.callCount()).isEqualTo(1);
            assertThat(anthropic.callCount()).isZero();
        }

        @Test
        @DisplayName("should time out a hanging call")
        void shouldTimeOutHangingCall() {
            openai.alwaysHang();

            AiServiceException failure = failureOf(controller()
                    .retryAttempts(0)
                    .fallbackEnabled(false)
                    .callTimeout(Duration.ofMillis(50))
                    .build()
                    .execute(request(), "openai"));

            assertThat(failure.getCode()).isEqualTo(ErrorCode.PROVIDER_UNAVAILABLE);
            assertThat(openai.callCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Fallback across providers")
    class Fallback {

        @Test
        @DisplayName("should fall back after retries are exhausted")
        void shouldFallBackAfterRetries() throws Exception {
            openai.alwaysFail(SERVER_ERROR);
            anthropic.alwaysSucceed("From anthropic");

            AiResponse response = controller().build().execute(request(), "openai").get(5, TimeUnit.SECONDS);

            assertThat(response.provider()).isEqualTo("anthropic");
            assertThat(response.content()).isEqualTo("From anthropic");
            assertThat(openai.callCount()).isEqualTo(3);
            assertThat(anthropic.callCount()).isEqualTo(1);
            assertThat(response.attempts()).isEqualTo(4);
        }

        @Test
        @DisplayName("should try the second provider after one retry on an unavailable first provider")
        void shouldFallBackWithSingleRetry() throws Exception {
            openai.alwaysFail(SERVER_ERROR);
            anthropic.alwaysSucceed("From anthropic");

            AiResponse response = controller().retryAttempts(1).build()
                    .execute(request(), "openai").get(5, TimeUnit.SECONDS);

            assertThat(response.provider()).isEqualTo("anthropic");
            assertThat(openai.callCount()).isEqualTo(2);
            assertThat(anthropic.callCount()).isEqualTo(1);
            assertThat(response.attempts()).isEqualTo(3);
        }

        @Test
        @DisplayName("should switch provider on quota exceeded without retrying")
        void shouldSwitchOnQuotaExceeded() throws Exception {
            openai.alwaysFail(ProviderCallException.httpStatus("openai", 403, "Quota exceeded"));

            AiResponse response = controller().build().execute(request(), "openai").get(5, TimeUnit.SECONDS);

            assertThat(response.provider()).isEqualTo("anthropic");
            assertThat(openai.callCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should switch provider after a network error")
        void shouldSwitchOnNetworkError() throws Exception {
            openai.alwaysFail(ProviderCallException.transport("openai", ProviderCallException.ECONNREFUSED,
                    new ConnectException("Connection refused")));

            AiResponse response = controller().retryAttempts(0).build()
                    .execute(request(), "openai").get(5, TimeUnit.SECONDS);

            assertThat(response.provider()).isEqualTo("anthropic");
        }

        @Test
        @DisplayName("should fail with the last provider error when all providers fail")
        void shouldFailWithLastError() {
            openai.alwaysFail(SERVER_ERROR);
            anthropic.alwaysFail(ProviderCallException.httpStatus("anthropic", 429, "Too many requests",
                    Duration.ofSeconds(12)));

            AiServiceException failure = failureOf(controller().build().execute(request(), "openai"));

            assertThat(failure.getCode()).isEqualTo(ErrorCode.RATE_LIMIT_EXCEEDED);
            assertThat(failure.getError().provider()).isEqualTo("anthropic");
            assertThat(failure.getError().getResetAt()).isPresent();
            assertThat(openai.callCount()).isEqualTo(3);
            assertThat(anthropic.callCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("should only try the primary provider when fallback is disabled")
        void shouldNotFallBackWhenDisabled() {
            openai.alwaysFail(SERVER_ERROR);

            AiServiceException failure = failureOf(controller().fallbackEnabled(false).build()
                    .execute(request(), "openai"));

            assertThat(failure.getCode()).isEqualTo(ErrorCode.PROVIDER_UNAVAILABLE);
            assertThat(anthropic.callCount()).isZero();
        }

        @Test
        @DisplayName("should start with the primary and follow the configured order")
        void shouldOrderSequenceFromPrimary() {
            FallbackRetryController controller = controller().build();

            assertThat(controller.sequenceFor("anthropic")).containsExactly("anthropic", "openai");
            assertThat(controller.sequenceFor("openai")).containsExactly("openai", "anthropic");
        }

        @Test
        @DisplayName("should skip a fallback provider at its rate limit")
        void shouldSkipRateLimitedFallback() {
            Instant resetAt = Instant.parse("2024-01-15T10:01:00Z");
            RecordingPermits permits = new RecordingPermits(false, resetAt);
            openai.alwaysFail(SERVER_ERROR);

            AiServiceException failure = failureOf(controller().permits(permits).build()
                    .execute(request(), "openai"));

            assertThat(failure.getCode()).isEqualTo(ErrorCode.RATE_LIMIT_EXCEEDED);
            assertThat(failure.getError().getResetAt()).contains(resetAt);
            assertThat(anthropic.callCount()).isZero();
        }

        @Test
        @DisplayName("should take a fallback permit once and release it when done")
        void shouldReleaseFallbackPermit() throws Exception {
            RecordingPermits permits = new RecordingPermits(true, null);
            openai.alwaysFail(SERVER_ERROR);
            anthropic.thenFail(SERVER_ERROR);

            controller().permits(permits).build().execute(request(), "openai").get(5, TimeUnit.SECONDS);

            assertThat(permits.acquired).containsExactly("anthropic");
            assertThat(permits.released).containsExactly("anthropic");
        }
    }

    @Test
    @DisplayName("should stop without further attempts once cancelled")
    void shouldStopWhenCancelled() {
        CompletableFuture<AiResponse> result = controller().build().execute(request(), "openai", () -> true);

        assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(CancellationException.class);
        assertThat(openai.callCount()).isZero();
    }

    @Test
    @DisplayName("should record provider health from attempts")
    void shouldRecordHealth() throws Exception {
        openai.alwaysFail(SERVER_ERROR);

        controller().build().execute(request(), "openai").get(5, TimeUnit.SECONDS);

        assertThat(health.getStatus("openai").consecutiveFailures()).isEqualTo(3);
        assertThat(health.getHealth("openai")).isEqualTo(ProviderHealth.DEGRADED);
        assertThat(health.getHealth("anthropic")).isEqualTo(ProviderHealth.UP);
    }

    @Test
    @DisplayName("should require collaborators")
    void shouldRequireCollaborators() {
        assertThatThrownBy(() -> FallbackRetryController.builder().build())
                .isInstanceOf(IllegalStateException.class);
    }

    private static final class RecordingPermits implements ProviderPermits {
        private final boolean grant;
        private final Instant resetAt;
        private final List<String> acquired = new ArrayList<>();
        private final List<String> released = new ArrayList<>();

        RecordingPermits(boolean grant, Instant resetAt) {
            this.grant = grant;
            this.resetAt = resetAt;
        }

        @Override
        public synchronized boolean tryAcquire(String provider) {
            if (grant) {
                acquired.add(provider);
            }
            return grant;
        }

        @Override
        public synchronized void release(String provider) {
            released.add(provider);
        }

        @Override
        public Optional<Instant> resetAt(String provider) {
            return Optional.ofNullable(resetAt);
        }
    }
}
