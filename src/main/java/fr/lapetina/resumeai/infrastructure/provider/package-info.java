/**
 * HTTP clients for LLM providers.
 *
 * <p>Clients issue exactly one call per invocation. Failures surface raw, as a
 * {@link fr.lapetina.resumeai.infrastructure.provider.ProviderCallException} carrying the
 * HTTP status or a transport code; classification happens in the resilience layer.
 *
 * <h2>Supported Providers</h2>
 * <ul>
 *   <li>{@code openai} - Chat completions API</li>
 *   <li>{@code anthropic} - Messages API</li>
 * </ul>
 */
package fr.lapetina.resumeai.infrastructure.provider;
