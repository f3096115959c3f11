package fr.lapetina.resumeai;

import fr.lapetina.resumeai.admission.AdmissionController;
import fr.lapetina.resumeai.infrastructure.cache.CacheManager;
import fr.lapetina.resumeai.infrastructure.config.ConfigLoader;
import fr.lapetina.resumeai.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.resumeai.infrastructure.config.ConfigValidator;
import fr.lapetina.resumeai.infrastructure.config.OrchestratorConfig;
import fr.lapetina.resumeai.infrastructure.config.OrchestratorConfig.ProviderConfig;
import fr.lapetina.resumeai.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.resumeai.infrastructure.provider.ProviderClient;
import fr.lapetina.resumeai.infrastructure.provider.ProviderClientFactory;
import fr.lapetina.resumeai.resilience.ErrorClassifier;
import fr.lapetina.resumeai.resilience.FallbackRetryController;
import fr.lapetina.resumeai.resilience.ProviderHealthRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds a fully wired orchestrator from configuration.
 * This is the primary entry point for obtaining an {@link AiOrchestrator}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (OrchestratorFactory factory = OrchestratorFactory.create("config.yaml").start()) {
 *     AiOrchestrator orchestrator = factory.getOrchestrator();
 *     // submit requests...
 * }
 * }</pre>
 *
 * An invalid configuration is refused before any thread is started: every validation
 * message is logged and the constructor throws a {@link ConfigurationException} listing them.
 */
public class OrchestratorFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorFactory.class);

    private final OrchestratorConfig config;
    private final Clock clock;
    private final MetricsRegistry metricsRegistry;
    private final Map<String, ProviderClient> clients;
    private final ProviderHealthRegistry healthRegistry;
    private final CacheManager cacheManager;
    private final ScheduledExecutorService retryScheduler;
    private final AdmissionController admissionController;
    private final AiOrchestrator orchestrator;

    // Assigned while the admission controller is built
    private FallbackRetryController fallbackController;

    /**
     * @param clientOverrides provider clients to use instead of HTTP clients, keyed by provider name
     */
    protected OrchestratorFactory(OrchestratorConfig config, Map<String, ProviderClient> clientOverrides, Clock clock) {
        this.config = config;
        this.clock = clock;

        ProviderClientFactory clientFactory = new ProviderClientFactory(
                Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs()),
                Duration.ofMillis(config.getTimeouts().getCallTimeoutMs()));
        validate(config, clientOverrides, clientFactory);

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix(), config.getMetrics().isEnabled());

        // Provider clients (allow override for testing)
        this.clients = createClients(clientOverrides, clientFactory);

        this.healthRegistry = new ProviderHealthRegistry(clients.keySet(), clock);
        registerHealthMetrics();

        this.cacheManager = new CacheManager(config.getCaches(), clock);
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(new RetryThreadFactory());

        ErrorClassifier classifier = new ErrorClassifier(clock);
        this.admissionController = AdmissionController.builder()
                .fromConfig(config)
                .metricsRegistry(metricsRegistry)
                .clock(clock)
                .dispatcher(permits -> {
                    this.fallbackController = FallbackRetryController.builder()
                            .fromConfig(config)
                            .clients(clients)
                            .classifier(classifier)
                            .scheduler(retryScheduler)
                            .permits(permits)
                            .health(healthRegistry)
                            .metrics(metricsRegistry)
                            .clock(clock)
                            .build();
                    return fallbackController::execute;
                })
                .build();

        this.orchestrator = new AiOrchestrator(admissionController, cacheManager, healthRegistry, metricsRegistry);

        log.info("OrchestratorFactory initialized: providers={}, providerOrder={}",
                clients.keySet(), config.getEnabledProviderOrder());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static OrchestratorFactory create(String configPath) {
        log.info("Initializing OrchestratorFactory from config: {}", configPath);
        return create(new ConfigLoader(configPath).load());
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static OrchestratorFactory create() {
        return create("config.yaml");
    }

    public static OrchestratorFactory create(OrchestratorConfig config) {
        return new OrchestratorFactory(config, Map.of(), Clock.systemUTC());
    }

    /**
     * Starts the cache sweepers and the admission scheduler.
     */
    public OrchestratorFactory start() {
        cacheManager.start();
        admissionController.start();
        log.info("Orchestrator started");
        return this;
    }

    public AiOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public AdmissionController getAdmissionController() {
        return admissionController;
    }

    public FallbackRetryController getFallbackController() {
        return fallbackController;
    }

    public ProviderHealthRegistry getHealthRegistry() {
        return healthRegistry;
    }

    public CacheManager getCacheManager() {
        return cacheManager;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public OrchestratorConfig getConfig() {
        return config;
    }

    public Clock getClock() {
        return clock;
    }

    private static void validate(
            OrchestratorConfig config,
            Map<String, ProviderClient> clientOverrides,
            ProviderClientFactory clientFactory
    ) {
        List<String> errors = new ArrayList<>(ConfigValidator.validate(config));
        if (config.getProviders() != null) {
            for (ProviderConfig provider : config.getProviders()) {
                if (provider.isEnabled()
                        && provider.getName() != null
                        && !clientOverrides.containsKey(provider.getName())
                        && provider.getType() != null
                        && !clientFactory.supports(provider.getType())) {
                    errors.add("Unsupported provider type '" + provider.getType()
                            + "' for provider " + provider.getName()
                            + ", known types: " + clientFactory.getRegisteredTypes());
                }
            }
        }

        if (!errors.isEmpty()) {
            for (String error : errors) {
                log.error("Configuration error: {}", error);
            }
            throw new ConfigurationException("Invalid configuration: " + String.join("; ", errors));
        }
    }

    private Map<String, ProviderClient> createClients(
            Map<String, ProviderClient> clientOverrides,
            ProviderClientFactory clientFactory
    ) {
        Map<String, ProviderClient> created = new LinkedHashMap<>();
        for (ProviderConfig provider : config.getProviders()) {
            if (!provider.isEnabled()) {
                log.info("Provider disabled, skipped: provider={}", provider.getName());
                continue;
            }
            ProviderClient client = clientOverrides.containsKey(provider.getName())
                    ? clientOverrides.get(provider.getName())
                    : clientFactory.create(provider).orElseThrow(() -> new ConfigurationException(
                            "Unsupported provider type: " + provider.getType()));
            created.put(provider.getName(), client);
            log.debug("Registered provider client: provider={}, type={}, model={}",
                    provider.getName(), provider.getType(), provider.getModel());
        }
        return created;
    }

    private void registerHealthMetrics() {
        for (String provider : clients.keySet()) {
            metricsRegistry.registerProviderHealth(provider, () -> {
                return switch (healthRegistry.getHealth(provider)) {
                    case UP -> 2;
                    case DEGRADED -> 1;
                    case DOWN -> 0;
                };
            });
        }
    }

    @Override
    public void close() {
        log.info("Shutting down OrchestratorFactory...");

        try {
            admissionController.close();
        } catch (Exception e) {
            log.warn("Error closing admission controller", e);
        }

        try {
            retryScheduler.shutdownNow();
        } catch (Exception e) {
            log.warn("Error stopping retry scheduler", e);
        }

        for (Map.Entry<String, ProviderClient> entry : clients.entrySet()) {
            try {
                entry.getValue().close();
            } catch (Exception e) {
                log.warn("Error closing provider client: provider={}", entry.getKey(), e);
            }
        }

        try {
            cacheManager.close();
        } catch (Exception e) {
            log.warn("Error closing cache manager", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("OrchestratorFactory shut down");
    }

    private static class RetryThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "provider-retry-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
