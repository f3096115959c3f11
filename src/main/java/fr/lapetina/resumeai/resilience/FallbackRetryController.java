package fr.lapetina.resumeai.resilience;

import fr.lapetina.resumeai.domain.exception.AiServiceException;
import fr.lapetina.resumeai.domain.model.AiRequest;
import fr.lapetina.resumeai.domain.model.AiResponse;
import fr.lapetina.resumeai.domain.model.ClassifiedError;
import fr.lapetina.resumeai.domain.model.ErrorCode;
import fr.lapetina.resumeai.infrastructure.config.OrchestratorConfig;
import fr.lapetina.resumeai.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.resumeai.infrastructure.provider.ProviderClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Drives the bounded attempt sequence of one request across providers.
 *
 * <ol>
 *   <li>The primary provider is tried first, the others follow in configured order.</li>
 *   <li>A retryable failure is retried on the same provider after an exponential backoff,
 *       up to {@code retryAttempts} times.</li>
 *   <li>PROVIDER_UNAVAILABLE and QUOTA_EXCEEDED, or an exhausted retry budget, move on to
 *       the next provider with a fresh budget.</li>
 *   <li>AUTHENTICATION_ERROR and INVALID_REQUEST end the sequence immediately.</li>
 * </ol>
 *
 * Total attempts never exceed {@code providers * (retryAttempts + 1)}. No thread blocks:
 * provider calls are asynchronous and backoff waits are scheduled.
 */
public final class FallbackRetryController {

    private static final Logger log = LoggerFactory.getLogger(FallbackRetryController.class);

    private final Map<String, ProviderClient> clients;
    private final List<String> providerOrder;
    private final ErrorClassifier classifier;
    private final BackoffPolicy backoff;
    private final int retryAttempts;
    private final boolean fallbackEnabled;
    private final Duration callTimeout;
    private final ScheduledExecutorService scheduler;
    private final ProviderPermits permits;
    private final ProviderHealthRegistry health;
    private final MetricsRegistry metrics;
    private final Clock clock;

    private FallbackRetryController(Builder builder) {
        this.clients = Map.copyOf(builder.clients);
        this.providerOrder = List.copyOf(builder.providerOrder);
        this.classifier = builder.classifier;
        this.backoff = builder.backoff;
        this.retryAttempts = builder.retryAttempts;
        this.fallbackEnabled = builder.fallbackEnabled;
        this.callTimeout = builder.callTimeout;
        this.scheduler = builder.scheduler;
        this.permits = builder.permits;
        this.health = builder.health;
        this.metrics = builder.metrics;
        this.clock = builder.clock;

        log.info("FallbackRetryController created: providerOrder={}, retryAttempts={}, fallbackEnabled={}, "
                        + "baseDelayMs={}, maxDelayMs={}, callTimeoutMs={}",
                providerOrder, retryAttempts, fallbackEnabled,
                backoff.getBaseDelay().toMillis(), backoff.getMaxDelay().toMillis(), callTimeout.toMillis());
    }

    /**
     * Runs the attempt sequence starting with the primary provider.
     *
     * @param primaryProvider provider whose admission slot the caller already holds
     * @param cancelled       checked before every new attempt; once true no further attempt starts
     * @return future completed with the response (attempts stamped) or failed with {@link AiServiceException}
     */
    public CompletableFuture<AiResponse> execute(AiRequest request, String primaryProvider, BooleanSupplier cancelled) {
        Execution execution = new Execution(request, sequenceFor(primaryProvider), cancelled);
        execution.attempt();
        return execution.result;
    }

    public CompletableFuture<AiResponse> execute(AiRequest request, String primaryProvider) {
        return execute(request, primaryProvider, () -> false);
    }

    /**
     * Providers in attempt order: the primary, then the rest of the configured order.
     */
    List<String> sequenceFor(String primaryProvider) {
        List<String> sequence = new ArrayList<>();
        sequence.add(primaryProvider);
        if (fallbackEnabled) {
            for (String name : providerOrder) {
                if (!name.equals(primaryProvider)) {
                    sequence.add(name);
                }
            }
        }
        return sequence;
    }

    public List<String> getProviderOrder() {
        return providerOrder;
    }

    /**
     * State of one request's attempt sequence. Only one attempt is outstanding at a time,
     * so fields are touched by one thread at a time.
     */
    private final class Execution {
        private final AiRequest request;
        private final List<String> sequence;
        private final BooleanSupplier cancelled;
        private final CompletableFuture<AiResponse> result = new CompletableFuture<>();
        private final Instant startedAt;

        private int providerIndex;
        private int failuresOnProvider;
        private int totalAttempts;
        private boolean permitHeld;
        private ClassifiedError lastError;

        Execution(AiRequest request, List<String> sequence, BooleanSupplier cancelled) {
            this.request = request;
            this.sequence = sequence;
            this.cancelled = cancelled;
            this.startedAt = clock.instant();
        }

        void attempt() {
            String provider = sequence.get(providerIndex);
            try (MDC.MDCCloseable ignoredRequest = MDC.putCloseable("requestId", request.id());
                 MDC.MDCCloseable ignoredProvider = MDC.putCloseable("provider", provider)) {

                if (cancelled.getAsBoolean()) {
                    log.info("Request cancelled, no further attempts: requestId={}, attempts={}",
                            request.id(), totalAttempts);
                    releasePermit();
                    result.completeExceptionally(new CancellationException("Request " + request.id() + " cancelled"));
                    return;
                }

                ProviderClient client = clients.get(provider);
                if (client == null) {
                    lastError = ClassifiedError.of(ErrorCode.PROVIDER_UNAVAILABLE, provider, request.id(),
                            "No client configured for provider " + provider, clock.instant());
                    log.warn("Provider not configured: requestId={}, provider={}", request.id(), provider);
                    advance();
                    return;
                }

                if (providerIndex > 0 && !permitHeld) {
                    if (!permits.tryAcquire(provider)) {
                        Instant resetAt = permits.resetAt(provider).orElse(null);
                        lastError = ClassifiedError.rateLimited(provider, request.id(),
                                "Rate limit reached for " + provider, resetAt, clock.instant());
                        log.warn("Fallback provider at capacity, skipping: requestId={}, provider={}, resetAt={}",
                                request.id(), provider, resetAt);
                        advance();
                        return;
                    }
                    permitHeld = true;
                }

                totalAttempts++;
                Instant callStart = clock.instant();
                log.debug("Attempting provider: requestId={}, provider={}, attempt={}, providerAttempt={}",
                        request.id(), provider, totalAttempts, failuresOnProvider + 1);

                CompletableFuture<AiResponse> call;
                try {
                    call = client.complete(request).copy();
                } catch (RuntimeException e) {
                    call = CompletableFuture.failedFuture(e);
                }
                call.orTimeout(callTimeout.toMillis(), TimeUnit.MILLISECONDS)
                        .whenComplete((response, ex) -> onAttemptComplete(provider, callStart, response, ex));
            }
        }

        private void onAttemptComplete(String provider, Instant callStart, AiResponse response, Throwable ex) {
            Duration latency = Duration.between(callStart, clock.instant());
            try (MDC.MDCCloseable ignoredRequest = MDC.putCloseable("requestId", request.id());
                 MDC.MDCCloseable ignoredProvider = MDC.putCloseable("provider", provider)) {

                if (ex == null) {
                    health.recordSuccess(provider, latency);
                    metrics.incrementAttempt(provider, "success");
                    metrics.recordProviderLatency(provider, latency);
                    releasePermit();
                    log.info("Request completed: requestId={}, provider={}, attempts={}, latencyMs={}",
                            request.id(), provider, totalAttempts, latency.toMillis());
                    result.complete(response.withAttempts(totalAttempts, Duration.between(startedAt, clock.instant())));
                    return;
                }

                ClassifiedError error = classifier.classify(ex, provider, request.id());
                lastError = error;
                health.recordFailure(provider, latency);
                metrics.incrementAttempt(provider, error.code().name());
                log.warn("Provider attempt failed: requestId={}, provider={}, attempt={}, code={}, retryable={}, error={}",
                        request.id(), provider, totalAttempts, error.code(), error.retryable(), error.message());

                decideNext(error);
            } catch (RuntimeException e) {
                log.error("Attempt handling failed: requestId={}, provider={}", request.id(), provider, e);
                releasePermit();
                ClassifiedError error = ClassifiedError.of(ErrorCode.UNKNOWN_ERROR, provider, request.id(),
                        "Attempt handling failed: " + e.getMessage(), clock.instant());
                metrics.incrementTerminalError(error.code());
                result.completeExceptionally(new AiServiceException(error, e));
            }
        }

        private void decideNext(ClassifiedError error) {
            if (cancelled.getAsBoolean()) {
                finish();
                return;
            }

            if (error.is(ErrorCode.AUTHENTICATION_ERROR) || error.is(ErrorCode.INVALID_REQUEST)) {
                finish();
                return;
            }

            if (error.retryable() && failuresOnProvider < retryAttempts) {
                Duration delay = backoff.delayFor(failuresOnProvider);
                failuresOnProvider++;
                log.info("Retrying provider: requestId={}, provider={}, retry={}/{}, delayMs={}",
                        request.id(), error.provider(), failuresOnProvider, retryAttempts, delay.toMillis());
                schedule(delay);
                return;
            }

            if (error.retryable() || error.code().isProviderLevel()) {
                advance();
                return;
            }

            finish();
        }

        private void advance() {
            releasePermit();
            providerIndex++;
            failuresOnProvider = 0;
            if (providerIndex >= sequence.size()) {
                finish();
                return;
            }
            log.warn("Falling back to next provider: requestId={}, provider={}, lastCode={}",
                    request.id(), sequence.get(providerIndex), lastError != null ? lastError.code() : null);
            attempt();
        }

        private void schedule(Duration delay) {
            try {
                scheduler.schedule(this::attempt, delay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.warn("Retry scheduler shut down, giving up: requestId={}", request.id());
                finish();
            }
        }

        private void finish() {
            releasePermit();
            ClassifiedError error = lastError != null
                    ? lastError
                    : ClassifiedError.of(ErrorCode.UNKNOWN_ERROR, null, request.id(),
                    "No provider attempt was made", clock.instant());
            metrics.incrementTerminalError(error.code());
            log.error("Request failed: requestId={}, code={}, provider={}, attempts={}, error={}",
                    request.id(), error.code(), error.provider(), totalAttempts, error.message());
            result.completeExceptionally(new AiServiceException(error));
        }

        private void releasePermit() {
            if (permitHeld) {
                permits.release(sequence.get(providerIndex));
                permitHeld = false;
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for FallbackRetryController.
     */
    public static final class Builder {
        private Map<String, ProviderClient> clients;
        private List<String> providerOrder;
        private ErrorClassifier classifier;
        private BackoffPolicy backoff = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(4));
        private int retryAttempts = 3;
        private boolean fallbackEnabled = true;
        private Duration callTimeout = Duration.ofSeconds(30);
        private ScheduledExecutorService scheduler;
        private ProviderPermits permits = ProviderPermits.UNLIMITED;
        private ProviderHealthRegistry health;
        private MetricsRegistry metrics;
        private Clock clock = Clock.systemUTC();

        public Builder clients(Map<String, ProviderClient> clients) {
            this.clients = clients;
            return this;
        }

        public Builder providerOrder(List<String> providerOrder) {
            this.providerOrder = providerOrder;
            return this;
        }

        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder backoff(BackoffPolicy backoff) {
            this.backoff = backoff;
            return this;
        }

        public Builder retryAttempts(int retryAttempts) {
            if (retryAttempts < 0) {
                throw new IllegalArgumentException("retryAttempts must not be negative");
            }
            this.retryAttempts = retryAttempts;
            return this;
        }

        public Builder fallbackEnabled(boolean fallbackEnabled) {
            this.fallbackEnabled = fallbackEnabled;
            return this;
        }

        public Builder callTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
            return this;
        }

        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder permits(ProviderPermits permits) {
            this.permits = permits;
            return this;
        }

        public Builder health(ProviderHealthRegistry health) {
            this.health = health;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder fromConfig(OrchestratorConfig config) {
            OrchestratorConfig.FallbackConfig fallback = config.getFallback();
            this.providerOrder = config.getEnabledProviderOrder();
            this.retryAttempts = fallback.getRetryAttempts();
            this.fallbackEnabled = fallback.isEnabled();
            this.backoff = new BackoffPolicy(
                    Duration.ofMillis(fallback.getBaseDelayMs()),
                    Duration.ofMillis(fallback.getMaxDelayMs()));
            this.callTimeout = Duration.ofMillis(config.getTimeouts().getCallTimeoutMs());
            return this;
        }

        public FallbackRetryController build() {
            if (clients == null || clients.isEmpty()) {
                throw new IllegalStateException("At least one ProviderClient is required");
            }
            if (providerOrder == null || providerOrder.isEmpty()) {
                throw new IllegalStateException("Provider order is required");
            }
            if (classifier == null) {
                throw new IllegalStateException("ErrorClassifier is required");
            }
            if (scheduler == null) {
                throw new IllegalStateException("ScheduledExecutorService is required");
            }
            if (health == null) {
                throw new IllegalStateException("ProviderHealthRegistry is required");
            }
            if (metrics == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new FallbackRetryController(this);
        }
    }
}
