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
 * Client for the OpenAI chat-completions API.
 */
public class OpenAiProviderClient extends HttpProviderClient {

    public static final String TYPE = "openai";
    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    private final String apiKey;

    public OpenAiProviderClient(ProviderConfig config, Duration connectTimeout, Duration requestTimeout) {
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
        return "chat/completions";
    }

    @Override
    protected void addAuthHeaders(HttpRequest.Builder builder) {
        builder.header("Authorization", "Bearer " + apiKey);
    }

    @Override
    protected Map<String, Object> buildRequestBody(AiRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", config.getModel());
        body.put("messages", List.of(Map.of("role", "user", "content", request.prompt())));
        body.put("max_tokens", config.getMaxTokens());
        body.put("temperature", config.getTemperature());
        return body;
    }

    @Override
    protected AiResponse parseSuccessResponse(AiRequest request, JsonNode body) {
        JsonNode content = body.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isEmpty()) {
            throw new IllegalStateException("No content in OpenAI response");
        }

        JsonNode usage = body.path("usage");
        TokenUsage tokens = new TokenUsage(
                intOrZero(usage.path("prompt_tokens")),
                intOrZero(usage.path("completion_tokens")),
                intOrZero(usage.path("total_tokens"))
        );
        String model = body.path("model").asText(config.getModel());
        return AiResponse.of(request.id(), name(), model, content.asText(), tokens);
    }
}
