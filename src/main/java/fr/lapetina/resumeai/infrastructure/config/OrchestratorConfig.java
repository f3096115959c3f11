package fr.lapetina.resumeai.infrastructure.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Root configuration object for the AI orchestrator.
 * Designed to be populated from YAML.
 */
public class OrchestratorConfig {

    private List<ProviderConfig> providers = new ArrayList<>();
    private FallbackConfig fallback = new FallbackConfig();
    private QueueConfig queue = new QueueConfig();
    private OwnerLimitsConfig ownerLimits = new OwnerLimitsConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private CachesConfig caches = new CachesConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public List<ProviderConfig> getProviders() { return providers; }
    public void setProviders(List<ProviderConfig> providers) { this.providers = providers; }

    public FallbackConfig getFallback() { return fallback; }
    public void setFallback(FallbackConfig fallback) { this.fallback = fallback; }

    public QueueConfig getQueue() { return queue; }
    public void setQueue(QueueConfig queue) { this.queue = queue; }

    public OwnerLimitsConfig getOwnerLimits() { return ownerLimits; }
    public void setOwnerLimits(OwnerLimitsConfig ownerLimits) { this.ownerLimits = ownerLimits; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public CachesConfig getCaches() { return caches; }
    public void setCaches(CachesConfig caches) { this.caches = caches; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public Optional<ProviderConfig> findProvider(String name) {
        return providers.stream()
                .filter(p -> p.getName() != null && p.getName().equals(name))
                .findFirst();
    }

    /**
     * Fallback order restricted to enabled providers.
     */
    public List<String> getEnabledProviderOrder() {
        List<String> order = new ArrayList<>();
        for (String name : fallback.getProviderOrder()) {
            findProvider(name)
                    .filter(ProviderConfig::isEnabled)
                    .ifPresent(p -> order.add(p.getName()));
        }
        return order;
    }

    /**
     * Individual LLM provider configuration.
     */
    public static class ProviderConfig {
        private String name;
        private String type;
        private String baseUrl;
        private String apiKey;
        private String apiKeyEnv;
        private String model;
        private int maxTokens = 2000;
        private double temperature = 0.7;
        private int requestsPerMinute = 60;
        private int concurrentRequests = 5;
        private boolean enabled = true;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getType() { return type != null ? type : name; }
        public void setType(String type) { this.type = type; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getApiKeyEnv() { return apiKeyEnv; }
        public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }

        public int getRequestsPerMinute() { return requestsPerMinute; }
        public void setRequestsPerMinute(int requestsPerMinute) { this.requestsPerMinute = requestsPerMinute; }

        public int getConcurrentRequests() { return concurrentRequests; }
        public void setConcurrentRequests(int concurrentRequests) { this.concurrentRequests = concurrentRequests; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        /**
         * API key from configuration, or from the environment variable named by apiKeyEnv.
         */
        public String resolveApiKey() {
            if (apiKey != null && !apiKey.isBlank()) {
                return apiKey;
            }
            if (apiKeyEnv != null && !apiKeyEnv.isBlank()) {
                String fromEnv = System.getenv(apiKeyEnv);
                return fromEnv != null ? fromEnv : "";
            }
            return "";
        }
    }

    /**
     * Retry and provider fallback configuration.
     */
    public static class FallbackConfig {
        private boolean enabled = true;
        private int retryAttempts = 3;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 4000;
        private List<String> providerOrder = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getRetryAttempts() { return retryAttempts; }
        public void setRetryAttempts(int retryAttempts) { this.retryAttempts = retryAttempts; }

        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }

        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }

        public List<String> getProviderOrder() { return providerOrder; }
        public void setProviderOrder(List<String> providerOrder) { this.providerOrder = providerOrder; }
    }

    /**
     * Admission queue and scheduler configuration.
     */
    public static class QueueConfig {
        private int maxQueueDepth = 100;
        private long queueTimeoutMs = 30000;
        private long dispatchIntervalMs = 1000;
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getMaxQueueDepth() { return maxQueueDepth; }
        public void setMaxQueueDepth(int maxQueueDepth) { this.maxQueueDepth = maxQueueDepth; }

        public long getQueueTimeoutMs() { return queueTimeoutMs; }
        public void setQueueTimeoutMs(long queueTimeoutMs) { this.queueTimeoutMs = queueTimeoutMs; }

        public long getDispatchIntervalMs() { return dispatchIntervalMs; }
        public void setDispatchIntervalMs(long dispatchIntervalMs) { this.dispatchIntervalMs = dispatchIntervalMs; }

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Per-owner request limits, applied at admission.
     */
    public static class OwnerLimitsConfig {
        private boolean enabled = true;
        private int requestsPerMinute = 60;
        private int requestsPerHour = 1000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getRequestsPerMinute() { return requestsPerMinute; }
        public void setRequestsPerMinute(int requestsPerMinute) { this.requestsPerMinute = requestsPerMinute; }

        public int getRequestsPerHour() { return requestsPerHour; }
        public void setRequestsPerHour(int requestsPerHour) { this.requestsPerHour = requestsPerHour; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long callTimeoutMs = 30000;
        private long connectTimeoutMs = 10000;

        public long getCallTimeoutMs() { return callTimeoutMs; }
        public void setCallTimeoutMs(long callTimeoutMs) { this.callTimeoutMs = callTimeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    /**
     * One cache instance per data category.
     */
    public static class CachesConfig {
        private CacheConfig aiResponse = new CacheConfig(200, 15 * 60_000L, 3 * 60_000L);
        private CacheConfig userContext = new CacheConfig(30, 20 * 60_000L, 5 * 60_000L);
        private CacheConfig resumeData = new CacheConfig(50, 10 * 60_000L, 2 * 60_000L);
        private CacheConfig templateData = new CacheConfig(20, 30 * 60_000L, 5 * 60_000L);

        public CacheConfig getAiResponse() { return aiResponse; }
        public void setAiResponse(CacheConfig aiResponse) { this.aiResponse = aiResponse; }

        public CacheConfig getUserContext() { return userContext; }
        public void setUserContext(CacheConfig userContext) { this.userContext = userContext; }

        public CacheConfig getResumeData() { return resumeData; }
        public void setResumeData(CacheConfig resumeData) { this.resumeData = resumeData; }

        public CacheConfig getTemplateData() { return templateData; }
        public void setTemplateData(CacheConfig templateData) { this.templateData = templateData; }
    }

    /**
     * Capacity, default TTL and sweep interval of a cache instance.
     */
    public static class CacheConfig {
        private int maxSize = 100;
        private long defaultTtlMs = 5 * 60_000L;
        private long cleanupIntervalMs = 60_000L;

        public CacheConfig() {
        }

        public CacheConfig(int maxSize, long defaultTtlMs, long cleanupIntervalMs) {
            this.maxSize = maxSize;
            this.defaultTtlMs = defaultTtlMs;
            this.cleanupIntervalMs = cleanupIntervalMs;
        }

        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }

        public long getDefaultTtlMs() { return defaultTtlMs; }
        public void setDefaultTtlMs(long defaultTtlMs) { this.defaultTtlMs = defaultTtlMs; }

        public long getCleanupIntervalMs() { return cleanupIntervalMs; }
        public void setCleanupIntervalMs(long cleanupIntervalMs) { this.cleanupIntervalMs = cleanupIntervalMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "resume_ai";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
