package fr.lapetina.resumeai.infrastructure.provider;

import fr.lapetina.resumeai.domain.model.AiRequest;
import fr.lapetina.resumeai.domain.model.AiResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Thin transport to one LLM provider.
 *
 * Implementations issue exactly one completion call per invocation and never retry
 * or classify: a failed call completes the future exceptionally with the raw error
 * (usually a {@link ProviderCallException}).
 */
public interface ProviderClient extends AutoCloseable {

    /**
     * Provider name as used in the fallback order and in rate-limit configuration.
     */
    String name();

    /**
     * Issues a completion call for the request.
     */
    CompletableFuture<AiResponse> complete(AiRequest request);

    @Override
    default void close() {
        // Default no-op
    }
}
