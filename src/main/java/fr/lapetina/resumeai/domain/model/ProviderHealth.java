package fr.lapetina.resumeai.domain.model;

/**
 * Observed health of an LLM provider.
 */
public enum ProviderHealth {
    UP,
    DEGRADED,
    DOWN
}
