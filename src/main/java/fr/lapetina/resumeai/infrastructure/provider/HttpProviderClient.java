package fr.lapetina.resumeai.infrastructure.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.resumeai.domain.model.AiRequest;
import fr.lapetina.resumeai.domain.model.AiResponse;
import fr.lapetina.resumeai.infrastructure.config.OrchestratorConfig.ProviderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Base class for provider clients speaking JSON over HTTP.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. Subclasses supply the endpoint,
 * the authentication headers, the request body and the parsing of a successful answer.
 */
public abstract class HttpProviderClient implements ProviderClient {

    private static final Logger log = LoggerFactory.getLogger(HttpProviderClient.class);

    static final Duration MAX_RETRY_AFTER = Duration.ofHours(24);

    protected final ProviderConfig config;
    protected final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    protected HttpProviderClient(ProviderConfig config, Duration connectTimeout, Duration requestTimeout) {
        this.config = Objects.requireNonNull(config, "Provider config is required");
        this.requestTimeout = requestTimeout;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public String name() {
        return config.getName();
    }

    /**
     * Path appended to the configured base URL, without leading slash.
     */
    protected abstract String endpointPath();

    protected abstract void addAuthHeaders(HttpRequest.Builder builder);

    protected abstract Map<String, Object> buildRequestBody(AiRequest request);

    /**
     * Maps a 2xx body to a response.
     *
     * @throws IllegalStateException when the body carries no usable content
     */
    protected abstract AiResponse parseSuccessResponse(AiRequest request, JsonNode body);

    @Override
    public CompletableFuture<AiResponse> complete(AiRequest request) {
        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(request);
        } catch (JsonProcessingException e) {
            log.error("Failed to build request: provider={}, requestId={}", name(), request.id(), e);
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Failed to build request: " + e.getMessage(), e));
        }

        Instant startTime = Instant.now();
        log.debug("Sending request: provider={}, requestId={}, endpoint={}",
                name(), request.id(), httpRequest.uri());

        CompletableFuture<AiResponse> result = new CompletableFuture<>();
        httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .whenComplete((response, ex) -> {
                    if (ex != null) {
                        result.completeExceptionally(toTransportFailure(request, ex));
                        return;
                    }
                    try {
                        result.complete(handleResponse(request, response, startTime));
                    } catch (RuntimeException e) {
                        result.completeExceptionally(e);
                    }
                });
        return result;
    }

    private HttpRequest buildHttpRequest(AiRequest request) throws JsonProcessingException {
        String body = objectMapper.writeValueAsString(buildRequestBody(request));

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(buildUri())
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("X-Request-ID", request.id())
                .POST(HttpRequest.BodyPublishers.ofString(body));
        addAuthHeaders(builder);
        return builder.build();
    }

    private URI buildUri() {
        String basePath = config.getBaseUrl();
        if (!basePath.endsWith("/")) {
            basePath += "/";
        }
        return URI.create(basePath + endpointPath());
    }

    private AiResponse handleResponse(AiRequest request, HttpResponse<String> response, Instant startTime) {
        Duration latency = Duration.between(startTime, Instant.now());
        int statusCode = response.statusCode();

        if (statusCode >= 200 && statusCode < 300) {
            log.debug("Request successful: provider={}, requestId={}, status={}, latencyMs={}",
                    name(), request.id(), statusCode, latency.toMillis());
            JsonNode body;
            try {
                body = objectMapper.readTree(response.body());
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to parse " + name() + " response: " + e.getOriginalMessage(), e);
            }
            return parseSuccessResponse(request, body);
        }

        log.warn("Request failed with HTTP error: provider={}, requestId={}, status={}, latencyMs={}",
                name(), request.id(), statusCode, latency.toMillis());
        Duration retryAfter = response.headers().firstValue("Retry-After")
                .map(HttpProviderClient::parseRetryAfter)
                .orElse(null);
        throw ProviderCallException.httpStatus(name(), statusCode, extractErrorMessage(response), retryAfter);
    }

    /**
     * Reads {@code error.message} (or a plain {@code error} string) from an error body.
     */
    private String extractErrorMessage(HttpResponse<String> response) {
        String fallback = "HTTP " + response.statusCode();
        String raw = response.body();
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            JsonNode error = objectMapper.readTree(raw).path("error");
            if (error.isTextual()) {
                return error.asText();
            }
            String message = error.path("message").asText(null);
            return message != null ? message : fallback;
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: provider={}, status={}", name(), response.statusCode());
            return fallback;
        }
    }

    /**
     * Retry-After is either delta-seconds or an HTTP date. The result lies between zero and
     * {@link #MAX_RETRY_AFTER}; null when the value is neither form.
     */
    static Duration parseRetryAfter(String value) {
        String trimmed = value.trim();
        try {
            return clampRetryAfter(Duration.ofSeconds(Long.parseLong(trimmed)));
        } catch (NumberFormatException notSeconds) {
            // Not delta-seconds, or too many digits for a long
            if (!trimmed.isEmpty() && trimmed.chars().allMatch(Character::isDigit)) {
                return MAX_RETRY_AFTER;
            }
            try {
                ZonedDateTime date = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
                return clampRetryAfter(Duration.between(Instant.now(), date.toInstant()));
            } catch (DateTimeParseException notDate) {
                return null;
            }
        }
    }

    private static Duration clampRetryAfter(Duration delta) {
        if (delta.isNegative()) {
            return Duration.ZERO;
        }
        return delta.compareTo(MAX_RETRY_AFTER) > 0 ? MAX_RETRY_AFTER : delta;
    }

    /**
     * I/O failures become transport errors; anything else is passed through untouched.
     */
    private Throwable toTransportFailure(AiRequest request, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (!(cause instanceof IOException)) {
            log.error("Request failed unexpectedly: provider={}, requestId={}", name(), request.id(), cause);
            return cause;
        }
        String code = transportCode(cause);
        log.warn("Provider connection error: provider={}, requestId={}, code={}, errorType={}, error={}",
                name(), request.id(), code, cause.getClass().getSimpleName(), cause.getMessage());
        return ProviderCallException.transport(name(), code, cause);
    }

    private static String transportCode(Throwable cause) {
        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (t instanceof UnknownHostException || t instanceof UnresolvedAddressException) {
                return ProviderCallException.ENOTFOUND;
            }
        }
        if (cause instanceof HttpTimeoutException) {
            return ProviderCallException.ETIMEDOUT;
        }
        if (cause instanceof ConnectException) {
            return ProviderCallException.ECONNREFUSED;
        }
        return ProviderCallException.ECONNRESET;
    }

    protected static int intOrZero(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? 0 : node.asInt();
    }
}
