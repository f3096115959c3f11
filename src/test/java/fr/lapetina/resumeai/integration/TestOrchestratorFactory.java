package fr.lapetina.resumeai.integration;

import fr.lapetina.resumeai.OrchestratorFactory;
import fr.lapetina.resumeai.infrastructure.config.ConfigLoader;
import fr.lapetina.resumeai.infrastructure.config.OrchestratorConfig;
import fr.lapetina.resumeai.infrastructure.provider.ProviderClient;
import fr.lapetina.resumeai.support.StubProviderClient;

import java.time.Clock;
import java.util.Map;

/**
 * Test extension of OrchestratorFactory wiring scriptable stub clients for every configured provider.
 */
public final class TestOrchestratorFactory extends OrchestratorFactory {

    private final StubProviderClient openai;
    private final StubProviderClient anthropic;

    private TestOrchestratorFactory(OrchestratorConfig config, StubProviderClient openai, StubProviderClient anthropic) {
        super(config, Map.<String, ProviderClient>of("openai", openai, "anthropic", anthropic), Clock.systemUTC());
        this.openai = openai;
        this.anthropic = anthropic;
    }

    /**
     * Creates and starts a test factory from the default test configuration.
     */
    public static TestOrchestratorFactory create() {
        return create(new ConfigLoader("test-config.yaml").load());
    }

    public static TestOrchestratorFactory create(OrchestratorConfig config) {
        TestOrchestratorFactory factory = new TestOrchestratorFactory(
                config, new StubProviderClient("openai"), new StubProviderClient("anthropic"));
        factory.start();
        return factory;
    }

    public StubProviderClient openai() {
        return openai;
    }

    public StubProviderClient anthropic() {
        return anthropic;
    }
}
