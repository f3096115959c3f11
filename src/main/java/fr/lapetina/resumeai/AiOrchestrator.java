package fr.lapetina.resumeai;

import fr.lapetina.resumeai.admission.AdmissionController;
import fr.lapetina.resumeai.admission.OwnerRateLimitStatus;
import fr.lapetina.resumeai.admission.QueueStatus;
import fr.lapetina.resumeai.admission.RateLimitStatus;
import fr.lapetina.resumeai.domain.model.AiRequest;
import fr.lapetina.resumeai.domain.model.AiResponse;
import fr.lapetina.resumeai.infrastructure.cache.CacheCategory;
import fr.lapetina.resumeai.infrastructure.cache.CacheManager;
import fr.lapetina.resumeai.infrastructure.cache.RequestFingerprint;
import fr.lapetina.resumeai.infrastructure.cache.ResponseCache;
import fr.lapetina.resumeai.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.resumeai.resilience.ProviderHealthRegistry;
import fr.lapetina.resumeai.resilience.ProviderHealthRegistry.ProviderHealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Single entry point for AI requests.
 *
 * A request whose fingerprint is in the AI-response cache is answered from the cache
 * without touching admission. Otherwise it goes through admission and the fallback
 * controller, and a successful response of a cacheable kind is written back.
 */
public final class AiOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AiOrchestrator.class);

    private final AdmissionController admission;
    private final CacheManager caches;
    private final ProviderHealthRegistry health;
    private final MetricsRegistry metrics;

    public AiOrchestrator(
            AdmissionController admission,
            CacheManager caches,
            ProviderHealthRegistry health,
            MetricsRegistry metrics
    ) {
        this.admission = Objects.requireNonNull(admission, "AdmissionController is required");
        this.caches = Objects.requireNonNull(caches, "CacheManager is required");
        this.health = Objects.requireNonNull(health, "ProviderHealthRegistry is required");
        this.metrics = Objects.requireNonNull(metrics, "MetricsRegistry is required");
    }

    /**
     * Submits a request. Never blocks.
     *
     * @return future completed with the response, or failed with an
     *         {@link fr.lapetina.resumeai.domain.exception.AiServiceException} carrying the last classified error
     */
    public CompletableFuture<AiResponse> submit(AiRequest request) {
        metrics.incrementSubmitted(request.kind());

        if (!request.kind().isCacheable()) {
            return admission.submit(request);
        }

        String cacheKey = RequestFingerprint.cacheKey(request);
        ResponseCache<AiResponse> responses = caches.aiResponses();
        Optional<AiResponse> cached = responses.get(cacheKey);
        if (cached.isPresent()) {
            metrics.recordCacheHit(CacheCategory.AI_RESPONSE.key());
            log.debug("Cache hit: requestId={}, kind={}", request.id(), request.kind());
            return CompletableFuture.completedFuture(cached.get().asCachedFor(request.id()));
        }
        metrics.recordCacheMiss(CacheCategory.AI_RESPONSE.key());

        CompletableFuture<AiResponse> admitted = admission.submit(request);
        CompletableFuture<AiResponse> result = admitted.thenApply(response -> {
            responses.set(cacheKey, response);
            return response;
        });
        // Cancelling the caller's future must reach the queued entry
        result.whenComplete((response, ex) -> {
            if (result.isCancelled()) {
                admitted.cancel(false);
            }
        });
        return result;
    }

    /**
     * Removes everything cached about an owner.
     */
    public void invalidateUserData(String ownerId) {
        caches.invalidateUserData(ownerId);
    }

    public Map<String, ProviderHealthStatus> getProviderHealth() {
        return health.getAll();
    }

    public QueueStatus getQueueStatus() {
        return admission.getStatus();
    }

    public Optional<RateLimitStatus> getRateLimitStatus(String provider) {
        return admission.getRateLimitStatus(provider);
    }

    public OwnerRateLimitStatus getOwnerRateLimitStatus(String ownerId) {
        return admission.getOwnerRateLimitStatus(ownerId);
    }

    public CompletableFuture<Void> clearQueue() {
        return admission.clearQueue();
    }

    public CacheManager getCaches() {
        return caches;
    }
}
