package fr.lapetina.resumeai.infrastructure.cache;

import java.time.Duration;

/**
 * Data categories with an independently configured cache instance.
 */
public enum CacheCategory {
    AI_RESPONSE("ai_response", 200, Duration.ofMinutes(15), Duration.ofMinutes(3)),
    USER_CONTEXT("user_context", 30, Duration.ofMinutes(20), Duration.ofMinutes(5)),
    RESUME_DATA("resume_data", 50, Duration.ofMinutes(10), Duration.ofMinutes(2)),
    TEMPLATE_DATA("template_data", 20, Duration.ofMinutes(30), Duration.ofMinutes(5));

    private final String key;
    private final int defaultMaxSize;
    private final Duration defaultTtl;
    private final Duration defaultCleanupInterval;

    CacheCategory(String key, int defaultMaxSize, Duration defaultTtl, Duration defaultCleanupInterval) {
        this.key = key;
        this.defaultMaxSize = defaultMaxSize;
        this.defaultTtl = defaultTtl;
        this.defaultCleanupInterval = defaultCleanupInterval;
    }

    /**
     * Name used in logs, thread names and metric tags.
     */
    public String key() {
        return key;
    }

    public int getDefaultMaxSize() {
        return defaultMaxSize;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public Duration getDefaultCleanupInterval() {
        return defaultCleanupInterval;
    }
}
