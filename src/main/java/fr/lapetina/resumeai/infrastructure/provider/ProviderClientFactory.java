package fr.lapetina.resumeai.infrastructure.provider;

import fr.lapetina.resumeai.infrastructure.config.OrchestratorConfig.ProviderConfig;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates provider clients by configured provider type.
 *
 * Built-in types are {@code openai} and {@code anthropic}; additional types can be registered.
 */
public final class ProviderClientFactory {

    /**
     * Constructor reference for a provider client implementation.
     */
    @FunctionalInterface
    public interface Creator {
        ProviderClient create(ProviderConfig config, Duration connectTimeout, Duration requestTimeout);
    }

    private final Map<String, Creator> registry = new ConcurrentHashMap<>();
    private final Duration connectTimeout;
    private final Duration requestTimeout;

    public ProviderClientFactory(Duration connectTimeout, Duration requestTimeout) {
        this.connectTimeout = connectTimeout;
        this.requestTimeout = requestTimeout;

        // Register built-in providers
        register(OpenAiProviderClient.TYPE, OpenAiProviderClient::new);
        register(AnthropicProviderClient.TYPE, AnthropicProviderClient::new);
    }

    /**
     * Registers a custom provider type.
     *
     * @param type    Provider type (used in configuration)
     * @param creator Factory for creating client instances
     */
    public void register(String type, Creator creator) {
        registry.put(type.toLowerCase(), creator);
    }

    /**
     * Creates a client for the provider.
     *
     * @return Client instance, or empty if the type is not registered
     */
    public Optional<ProviderClient> create(ProviderConfig config) {
        String type = config.getType();
        if (type == null) {
            return Optional.empty();
        }
        Creator creator = registry.get(type.toLowerCase());
        if (creator == null) {
            return Optional.empty();
        }
        return Optional.of(creator.create(config, connectTimeout, requestTimeout));
    }

    public boolean supports(String type) {
        return type != null && registry.containsKey(type.toLowerCase());
    }

    public Set<String> getRegisteredTypes() {
        return Set.copyOf(registry.keySet());
    }
}
