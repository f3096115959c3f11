package fr.lapetina.resumeai.resilience;

import fr.lapetina.resumeai.domain.model.ProviderHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-provider health derived from the outcome of real provider calls.
 *
 * A provider turns DEGRADED after {@value #DEGRADED_THRESHOLD} consecutive failures and
 * DOWN after {@value #DOWN_THRESHOLD}; one success brings it back UP. Health is
 * informational and never reorders fallback.
 */
public final class ProviderHealthRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderHealthRegistry.class);

    static final int DEGRADED_THRESHOLD = 3;
    static final int DOWN_THRESHOLD = 6;
    static final int ERROR_RATE_WINDOW = 20;

    private final Map<String, ProviderStats> providers = new ConcurrentHashMap<>();
    private final Clock clock;

    public ProviderHealthRegistry(Collection<String> providerNames, Clock clock) {
        this.clock = clock;
        for (String name : providerNames) {
            providers.put(name, new ProviderStats(name));
        }
    }

    public void recordSuccess(String provider, Duration responseTime) {
        stats(provider).record(true, responseTime, clock.instant());
    }

    public void recordFailure(String provider, Duration responseTime) {
        stats(provider).record(false, responseTime, clock.instant());
    }

    public ProviderHealth getHealth(String provider) {
        ProviderStats stats = providers.get(provider);
        return stats != null ? stats.snapshot().health() : ProviderHealth.UP;
    }

    public ProviderHealthStatus getStatus(String provider) {
        return stats(provider).snapshot();
    }

    /**
     * Snapshot of every known provider, sorted by name.
     */
    public Map<String, ProviderHealthStatus> getAll() {
        Map<String, ProviderHealthStatus> result = new LinkedHashMap<>();
        providers.values().stream()
                .map(ProviderStats::snapshot)
                .sorted((a, b) -> a.provider().compareTo(b.provider()))
                .forEach(s -> result.put(s.provider(), s));
        return result;
    }

    private ProviderStats stats(String provider) {
        return providers.computeIfAbsent(provider, ProviderStats::new);
    }

    /**
     * Health snapshot of one provider.
     *
     * @param lastResponseTime latency of the most recent call, ZERO before any call
     * @param errorRate        failure ratio over the last calls, between 0 and 1
     * @param lastCheckedAt    time of the most recent call, null before any call
     */
    public record ProviderHealthStatus(
            String provider,
            ProviderHealth health,
            int consecutiveFailures,
            Duration lastResponseTime,
            double errorRate,
            Instant lastCheckedAt
    ) {
    }

    private static final class ProviderStats {
        private final String provider;
        private final ArrayDeque<Boolean> recentOutcomes = new ArrayDeque<>();
        private int consecutiveFailures;
        private ProviderHealth health = ProviderHealth.UP;
        private Duration lastResponseTime = Duration.ZERO;
        private Instant lastCheckedAt;

        ProviderStats(String provider) {
            this.provider = provider;
        }

        synchronized void record(boolean success, Duration responseTime, Instant now) {
            if (recentOutcomes.size() == ERROR_RATE_WINDOW) {
                recentOutcomes.removeFirst();
            }
            recentOutcomes.addLast(success);
            lastResponseTime = responseTime;
            lastCheckedAt = now;
            consecutiveFailures = success ? 0 : consecutiveFailures + 1;

            ProviderHealth previous = health;
            if (consecutiveFailures >= DOWN_THRESHOLD) {
                health = ProviderHealth.DOWN;
            } else if (consecutiveFailures >= DEGRADED_THRESHOLD) {
                health = ProviderHealth.DEGRADED;
            } else {
                health = ProviderHealth.UP;
            }
            if (previous != health) {
                log.info("Provider health changed: provider={}, {} -> {}, consecutiveFailures={}",
                        provider, previous, health, consecutiveFailures);
            }
        }

        synchronized ProviderHealthStatus snapshot() {
            long failures = recentOutcomes.stream().filter(ok -> !ok).count();
            double errorRate = recentOutcomes.isEmpty() ? 0.0 : (double) failures / recentOutcomes.size();
            return new ProviderHealthStatus(provider, health, consecutiveFailures,
                    lastResponseTime, errorRate, lastCheckedAt);
        }
    }
}
