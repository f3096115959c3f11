package fr.lapetina.resumeai.admission;

import fr.lapetina.resumeai.domain.model.AiRequest;
import fr.lapetina.resumeai.domain.model.AiResponse;

import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

/**
 * Runs an admitted request to completion. Called on the scheduler thread, must not block.
 */
@FunctionalInterface
public interface RequestDispatcher {

    /**
     * @param provider  provider whose admission slot is held for the whole call
     * @param cancelled becomes true when the caller cancels; no new attempt should start after that
     */
    CompletableFuture<AiResponse> dispatch(AiRequest request, String provider, BooleanSupplier cancelled);
}
