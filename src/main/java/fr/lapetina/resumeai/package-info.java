/**
 * Resume AI orchestrator - admission, fallback and caching in front of LLM providers.
 *
 * <p>Every AI request of the resume builder goes through this layer. It enforces per-provider
 * concurrency and per-minute limits, queues requests by priority, retries transient failures
 * with exponential backoff, falls back across providers in a configured order, and answers
 * repeated requests from a response cache.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.resumeai.OrchestratorFactory} - Builds a fully wired orchestrator
 *       from YAML configuration</li>
 *   <li>{@link fr.lapetina.resumeai.AiOrchestrator} - Single entry point for AI requests</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (OrchestratorFactory factory = OrchestratorFactory.create("config.yaml").start()) {
 *     AiOrchestrator orchestrator = factory.getOrchestrator();
 *
 *     AiRequest request = AiRequest.of(RequestKind.ANALYSIS, "user-42", "Review this resume...");
 *     AiResponse response = orchestrator.submit(request).get();
 *     System.out.println(response.content());
 * }
 * }</pre>
 *
 * <h2>Request Flow</h2>
 * <pre>
 * Cache lookup → Admission (queue, rate limit) → Provider attempts (retry, fallback) → Cache write
 * </pre>
 *
 * @see fr.lapetina.resumeai.OrchestratorFactory
 * @see fr.lapetina.resumeai.AiOrchestrator
 */
package fr.lapetina.resumeai;
