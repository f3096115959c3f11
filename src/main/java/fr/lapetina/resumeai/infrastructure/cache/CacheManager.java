package fr.lapetina.resumeai.infrastructure.cache;

import fr.lapetina.resumeai.domain.model.AiResponse;
import fr.lapetina.resumeai.infrastructure.config.OrchestratorConfig.CacheConfig;
import fr.lapetina.resumeai.infrastructure.config.OrchestratorConfig.CachesConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Owns one cache instance per {@link CacheCategory}.
 *
 * Keys follow the {@code prefix:part[:part...]} convention, e.g.
 * {@code ai_response:<fingerprint>} or {@code user_context:<ownerId>}.
 */
public final class CacheManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CacheManager.class);

    private static final Duration USER_PREFERENCES_TTL = Duration.ofHours(1);
    private static final Duration RESUME_LIST_TTL = Duration.ofMinutes(5);

    private final ResponseCache<AiResponse> aiResponses;
    private final ResponseCache<Object> userContext;
    private final ResponseCache<Object> resumeData;
    private final ResponseCache<Object> templateData;

    public CacheManager(CachesConfig config, Clock clock) {
        this.aiResponses = create(CacheCategory.AI_RESPONSE, config.getAiResponse(), clock);
        this.userContext = create(CacheCategory.USER_CONTEXT, config.getUserContext(), clock);
        this.resumeData = create(CacheCategory.RESUME_DATA, config.getResumeData(), clock);
        this.templateData = create(CacheCategory.TEMPLATE_DATA, config.getTemplateData(), clock);
    }

    private static <T> ResponseCache<T> create(CacheCategory category, CacheConfig config, Clock clock) {
        return new ResponseCache<>(
                category.key(),
                config.getMaxSize(),
                Duration.ofMillis(config.getDefaultTtlMs()),
                Duration.ofMillis(config.getCleanupIntervalMs()),
                clock
        );
    }

    /**
     * Builds a cache key from a prefix and its parts.
     */
    public static String key(String prefix, Object... parts) {
        StringJoiner joiner = new StringJoiner(":");
        joiner.add(prefix);
        for (Object part : parts) {
            joiner.add(String.valueOf(part));
        }
        return joiner.toString();
    }

    public void start() {
        aiResponses.start();
        userContext.start();
        resumeData.start();
        templateData.start();
    }

    public ResponseCache<AiResponse> aiResponses() {
        return aiResponses;
    }

    public ResponseCache<Object> userContext() {
        return userContext;
    }

    public ResponseCache<Object> resumeData() {
        return resumeData;
    }

    public ResponseCache<Object> templateData() {
        return templateData;
    }

    // User context

    public void cacheUserContext(String ownerId, Object context) {
        userContext.set(key("user_context", ownerId), context);
    }

    public Optional<Object> getUserContext(String ownerId) {
        return userContext.get(key("user_context", ownerId));
    }

    public void cacheUserPreferences(String ownerId, Object preferences) {
        userContext.set(key("user_preferences", ownerId), preferences, USER_PREFERENCES_TTL);
    }

    public Optional<Object> getUserPreferences(String ownerId) {
        return userContext.get(key("user_preferences", ownerId));
    }

    // Resume data

    public void cacheResume(String resumeId, Object resume) {
        resumeData.set(key("resume", resumeId), resume);
    }

    public Optional<Object> getResume(String resumeId) {
        return resumeData.get(key("resume", resumeId));
    }

    public void cacheResumeList(String ownerId, Object resumes) {
        resumeData.set(key("resumes", ownerId), resumes, RESUME_LIST_TTL);
    }

    public Optional<Object> getResumeList(String ownerId) {
        return resumeData.get(key("resumes", ownerId));
    }

    // Template data

    public void cacheTemplate(String templateId, Object template) {
        templateData.set(key("template", templateId), template);
    }

    public Optional<Object> getTemplate(String templateId) {
        return templateData.get(key("template", templateId));
    }

    /**
     * Removes the owner's context, preferences and resume list.
     */
    public void invalidateUserData(String ownerId) {
        userContext.delete(key("user_context", ownerId));
        userContext.delete(key("user_preferences", ownerId));
        resumeData.delete(key("resumes", ownerId));
        log.debug("User data invalidated: ownerId={}", ownerId);
    }

    public void invalidateResume(String resumeId) {
        resumeData.delete(key("resume", resumeId));
    }

    public Map<CacheCategory, CacheStats> getStats() {
        Map<CacheCategory, CacheStats> stats = new EnumMap<>(CacheCategory.class);
        stats.put(CacheCategory.AI_RESPONSE, aiResponses.getStats());
        stats.put(CacheCategory.USER_CONTEXT, userContext.getStats());
        stats.put(CacheCategory.RESUME_DATA, resumeData.getStats());
        stats.put(CacheCategory.TEMPLATE_DATA, templateData.getStats());
        return stats;
    }

    public int totalSize() {
        return aiResponses.size() + userContext.size() + resumeData.size() + templateData.size();
    }

    public void clearAll() {
        aiResponses.clear();
        userContext.clear();
        resumeData.clear();
        templateData.clear();
        log.info("All caches cleared");
    }

    @Override
    public void close() {
        aiResponses.close();
        userContext.close();
        resumeData.close();
        templateData.close();
    }
}
