package fr.lapetina.resumeai.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.resumeai.domain.model.AiRequest;
import fr.lapetina.resumeai.domain.model.AiResponse;
import fr.lapetina.resumeai.domain.model.TokenUsage;
import fr.lapetina.resumeai.infrastructure.config.OrchestratorConfig.ProviderConfig;

import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for the Anthropic messages API.
 */
public class AnthropicProviderClient extends HttpProviderClient {

    public static final String TYPE = "anthropic";
    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com/v1";
    static final String API_VERSION = "2023-06-01";

    private final String apiKey;

    public AnthropicProviderClient(ProviderConfig config, Duration connectTimeout, Duration requestTimeout) {
        super(withDefaultBaseUrl(config), connectTimeout, requestTimeout);
        this.apiKey = config.resolveApiKey();
    }

    private static ProviderConfig withDefaultBaseUrl(ProviderConfig config) {
        if (config.getBaseUrl() == null || config.getBaseUrl().isBlank()) {
            config.setBaseUrl(DEFAULT_BASE_URL);
        }
        return config;
    }

    @Override
    protected String endpointPath() {
        return "messages";
    }

    @Override
    protected void addAuthHeaders(HttpRequest.Builder builder) {
        builder.header("x-api-key", apiKey);
        builder.header("anthropic-version", API_VERSION);
    }

    @Override
    protected Map<String, Object> buildRequestBody(AiRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", config.getModel());
        body.put("max_tokens", config.getMaxTokens());
        body.put("temperature", config.getTemperature());
        body.put("messages", List.of(Map.of("role", "user", "content", request.prompt())));
        return body;
    }

    @Override
    protected AiResponse parseSuccessResponse(AiRequest request, JsonNode body) {
        JsonNode first = body.path("content").path(0);
        if (!"text".equals(first.path("type").asText())) {
            throw new IllegalStateException("Unexpected content type from Anthropic");
        }

        JsonNode usage = body.path("usage");
        TokenUsage tokens = TokenUsage.of(
                intOrZero(usage.path("input_tokens")),
                intOrZero(usage.path("output_tokens"))
        );
        String model = body.path("model").asText(config.getModel());
        return AiResponse.of(request.id(), name(), model, first.path("text").asText(), tokens);
    }
}
