package fr.lapetina.resumeai.infrastructure.metrics;

import fr.lapetina.resumeai.domain.model.ErrorCode;
import fr.lapetina.resumeai.domain.model.RequestKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Submission counters per request kind
 * - Admission rejection and terminal error counters per error code
 * - Provider attempt counters and latency timers
 * - Cache hit/miss counters per cache category
 * - Queue depth and active request gauges per provider
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;
    private final boolean enabled;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix, boolean enabled) {
        this.prefix = prefix;
        this.enabled = enabled;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        if (enabled) {
            // Register JVM metrics
            new JvmMemoryMetrics().bindTo(registry);
            new JvmGcMetrics().bindTo(registry);
            new JvmThreadMetrics().bindTo(registry);
            new ProcessorMetrics().bindTo(registry);
        }

        log.info("MetricsRegistry initialized: prefix={}, enabled={}", prefix, enabled);
    }

    public MetricsRegistry() {
        this("resume_ai", true);
    }

    public void incrementSubmitted(RequestKind kind) {
        if (!enabled) {
            return;
        }
        counter("submitted:" + kind, () -> Counter.builder(prefix + "_requests_submitted_total")
                .description("AI requests submitted")
                .tag("kind", kind.name())
                .register(registry)).increment();
    }

    /**
     * Counts a request refused by admission (queue full or timed out in queue).
     */
    public void incrementRejected(String provider, ErrorCode code) {
        if (!enabled) {
            return;
        }
        counter("rejected:" + provider + ":" + code, () -> Counter.builder(prefix + "_requests_rejected_total")
                .description("AI requests rejected by admission")
                .tag("provider", provider)
                .tag("code", code.name())
                .register(registry)).increment();
    }

    /**
     * Counts one provider call; outcome is "success" or an error code name.
     */
    public void incrementAttempt(String provider, String outcome) {
        if (!enabled) {
            return;
        }
        counter("attempt:" + provider + ":" + outcome, () -> Counter.builder(prefix + "_provider_attempts_total")
                .description("Provider call attempts")
                .tag("provider", provider)
                .tag("outcome", outcome)
                .register(registry)).increment();
    }

    public void incrementTerminalError(ErrorCode code) {
        if (!enabled) {
            return;
        }
        counter("error:" + code, () -> Counter.builder(prefix + "_errors_total")
                .description("AI requests that failed after all attempts")
                .tag("code", code.name())
                .register(registry)).increment();
    }

    public void recordProviderLatency(String provider, Duration latency) {
        if (!enabled) {
            return;
        }
        latencyTimers.computeIfAbsent(provider, k ->
                Timer.builder(prefix + "_provider_latency")
                        .description("Provider call latency")
                        .tag("provider", provider)
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    public void recordCacheHit(String category) {
        if (!enabled) {
            return;
        }
        counter("cache:" + category + ":hit", () -> Counter.builder(prefix + "_cache_requests_total")
                .description("Cache lookups")
                .tag("cache", category)
                .tag("result", "hit")
                .register(registry)).increment();
    }

    public void recordCacheMiss(String category) {
        if (!enabled) {
            return;
        }
        counter("cache:" + category + ":miss", () -> Counter.builder(prefix + "_cache_requests_total")
                .description("Cache lookups")
                .tag("cache", category)
                .tag("result", "miss")
                .register(registry)).increment();
    }

    /**
     * Registers a gauge for the number of requests waiting for a provider.
     */
    public void registerQueueDepth(String provider, Supplier<Number> valueSupplier) {
        if (!enabled) {
            return;
        }
        Gauge.builder(prefix + "_queue_depth", valueSupplier, s -> s.get().doubleValue())
                .description("Requests waiting in the admission queue")
                .tag("provider", provider)
                .register(registry);
    }

    /**
     * Registers a gauge for the number of requests holding an admission slot.
     */
    public void registerActiveRequests(String provider, Supplier<Number> valueSupplier) {
        if (!enabled) {
            return;
        }
        Gauge.builder(prefix + "_active_requests", valueSupplier, s -> s.get().doubleValue())
                .description("Requests dispatched and not yet completed")
                .tag("provider", provider)
                .register(registry);
    }

    /**
     * Registers a gauge for provider health (0=DOWN, 1=DEGRADED, 2=UP).
     */
    public void registerProviderHealth(String provider, Supplier<Number> healthValue) {
        if (!enabled) {
            return;
        }
        Gauge.builder(prefix + "_provider_health", healthValue, s -> s.get().doubleValue())
                .description("Provider health status (0=DOWN, 1=DEGRADED, 2=UP)")
                .tag("provider", provider)
                .register(registry);
    }

    private Counter counter(String key, Supplier<Counter> creator) {
        return counters.computeIfAbsent(key, k -> creator.get());
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
