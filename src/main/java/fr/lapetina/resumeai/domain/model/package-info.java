/**
 * Immutable domain model: requests, responses, classified errors and provider health.
 */
package fr.lapetina.resumeai.domain.model;
