/**
 * Error classification, retry with backoff, provider fallback and health tracking.
 *
 * @see fr.lapetina.resumeai.resilience.FallbackRetryController
 */
package fr.lapetina.resumeai.resilience;
