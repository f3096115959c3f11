/**
 * Configuration loading and validation.
 *
 * <p>The configuration is read once from YAML at startup and validated before anything is
 * wired. Validation collects every violation instead of stopping at the first one.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code providers} - LLM providers: type, model, API key, limits</li>
 *   <li>{@code fallback} - Retry attempts, backoff delays and provider order</li>
 *   <li>{@code queue} - Queue depth, queue timeout, dispatch interval, ring buffer</li>
 *   <li>{@code timeouts} - Provider call and connection timeouts</li>
 *   <li>{@code caches} - Size, TTL and cleanup interval of each cache category</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.resumeai.infrastructure.config.OrchestratorConfig
 * @see fr.lapetina.resumeai.infrastructure.config.ConfigLoader
 */
package fr.lapetina.resumeai.infrastructure.config;
