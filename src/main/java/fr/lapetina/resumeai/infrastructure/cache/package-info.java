/**
 * Bounded in-memory TTL caches for AI responses and resume builder data.
 */
package fr.lapetina.resumeai.infrastructure.cache;
