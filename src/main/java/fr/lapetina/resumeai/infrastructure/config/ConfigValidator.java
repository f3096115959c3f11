package fr.lapetina.resumeai.infrastructure.config;

import fr.lapetina.resumeai.infrastructure.config.OrchestratorConfig.CacheConfig;
import fr.lapetina.resumeai.infrastructure.config.OrchestratorConfig.ProviderConfig;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a loaded configuration before anything is wired.
 *
 * Every violated field yields its own message; nothing is thrown here.
 */
public final class ConfigValidator {

    private ConfigValidator() {
        // Utility class
    }

    /**
     * @return one message per violation, empty when the configuration is usable
     */
    public static List<String> validate(OrchestratorConfig config) {
        List<String> errors = new ArrayList<>();

        validateProviders(config, errors);
        validateFallback(config, errors);
        validateQueue(config.getQueue(), errors);
        validateOwnerLimits(config.getOwnerLimits(), errors);

        if (config.getTimeouts().getCallTimeoutMs() <= 0) {
            errors.add("Call timeout must be greater than 0");
        }
        if (config.getTimeouts().getConnectTimeoutMs() <= 0) {
            errors.add("Connect timeout must be greater than 0");
        }

        OrchestratorConfig.CachesConfig caches = config.getCaches();
        validateCache("aiResponse", caches.getAiResponse(), errors);
        validateCache("userContext", caches.getUserContext(), errors);
        validateCache("resumeData", caches.getResumeData(), errors);
        validateCache("templateData", caches.getTemplateData(), errors);

        return errors;
    }

    private static void validateProviders(OrchestratorConfig config, List<String> errors) {
        if (config.getProviders() == null || config.getProviders().isEmpty()) {
            errors.add("At least one AI provider must be configured");
            return;
        }

        Set<String> names = new HashSet<>();
        boolean anyKey = false;
        for (ProviderConfig provider : config.getProviders()) {
            String name = provider.getName();
            if (name == null || name.isBlank()) {
                errors.add("Provider name is required");
                continue;
            }
            if (!names.add(name)) {
                errors.add("Duplicate provider name: " + name);
            }
            if (provider.getType() == null || provider.getType().isBlank()) {
                errors.add("Provider type is required for provider " + name);
            }
            if (provider.getModel() == null || provider.getModel().isBlank()) {
                errors.add("Model is required for provider " + name);
            }
            if (provider.getRequestsPerMinute() <= 0) {
                errors.add("Requests per minute must be greater than 0 for provider " + name);
            }
            if (provider.getConcurrentRequests() <= 0) {
                errors.add("Concurrent requests must be greater than 0 for provider " + name);
            }
            if (provider.getMaxTokens() <= 0) {
                errors.add("Max tokens must be greater than 0 for provider " + name);
            }

            String key = provider.resolveApiKey();
            if (!key.isEmpty()) {
                if (provider.isEnabled()) {
                    anyKey = true;
                }
                validateKeyFormat(provider, key, errors);
            }
        }

        if (!anyKey) {
            errors.add("At least one AI provider API key must be configured");
        }
    }

    private static void validateKeyFormat(ProviderConfig provider, String key, List<String> errors) {
        String type = provider.getType() != null ? provider.getType().toLowerCase() : "";
        if (type.equals("openai") && !key.startsWith("sk-")) {
            errors.add("OpenAI API key appears to be invalid for provider " + provider.getName());
        }
        if (type.equals("anthropic") && !key.startsWith("sk-ant-")) {
            errors.add("Anthropic API key appears to be invalid for provider " + provider.getName());
        }
    }

    private static void validateOwnerLimits(OrchestratorConfig.OwnerLimitsConfig owner, List<String> errors) {
        if (!owner.isEnabled()) {
            return;
        }
        if (owner.getRequestsPerMinute() <= 0) {
            errors.add("Owner requests per minute must be greater than 0");
        }
        if (owner.getRequestsPerHour() <= 0) {
            errors.add("Owner requests per hour must be greater than 0");
        } else if (owner.getRequestsPerHour() < owner.getRequestsPerMinute()) {
            errors.add("Owner requests per hour must not be lower than owner requests per minute");
        }
    }

    private static void validateFallback(OrchestratorConfig config, List<String> errors) {
        OrchestratorConfig.FallbackConfig fallback = config.getFallback();
        if (fallback.getRetryAttempts() < 0) {
            errors.add("Retry attempts cannot be negative");
        }
        if (fallback.getBaseDelayMs() < 0) {
            errors.add("Base retry delay cannot be negative");
        }
        if (fallback.getMaxDelayMs() < fallback.getBaseDelayMs()) {
            errors.add("Max retry delay must not be lower than base retry delay");
        }

        List<String> order = fallback.getProviderOrder();
        if (order == null || order.isEmpty()) {
            errors.add("Provider order must name at least one provider");
            return;
        }
        for (String name : order) {
            if (config.findProvider(name).isEmpty()) {
                errors.add("Provider order names unknown provider: " + name);
            }
        }
        if (config.getEnabledProviderOrder().isEmpty()) {
            errors.add("Provider order must include at least one enabled provider");
        }
    }

    private static void validateQueue(OrchestratorConfig.QueueConfig queue, List<String> errors) {
        if (queue.getMaxQueueDepth() <= 0) {
            errors.add("Max queue depth must be greater than 0");
        }
        if (queue.getQueueTimeoutMs() <= 0) {
            errors.add("Queue timeout must be greater than 0");
        }
        if (queue.getDispatchIntervalMs() <= 0) {
            errors.add("Dispatch interval must be greater than 0");
        }
        if (queue.getRingBufferSize() <= 0 || Integer.bitCount(queue.getRingBufferSize()) != 1) {
            errors.add("Ring buffer size must be a power of 2");
        }
    }

    private static void validateCache(String name, CacheConfig cache, List<String> errors) {
        if (cache.getMaxSize() <= 0) {
            errors.add("Cache " + name + " max size must be greater than 0");
        }
        if (cache.getDefaultTtlMs() <= 0) {
            errors.add("Cache " + name + " TTL must be greater than 0");
        }
        if (cache.getCleanupIntervalMs() <= 0) {
            errors.add("Cache " + name + " cleanup interval must be greater than 0");
        }
    }
}
