package fr.lapetina.resumeai.domain.model;

/**
 * Category of work an AI request performs for the resume builder.
 */
public enum RequestKind {
    /** Bullet points, summaries, action verbs and other generated text */
    CONTENT_GENERATION,

    /** Resume scoring and ATS analysis */
    ANALYSIS,

    /** Refresh of the per-user context snapshot */
    CONTEXT_UPDATE,

    /** Side-by-side comparison of resumes or job descriptions */
    COMPARISON;

    /**
     * Context updates always reflect the latest user state and are never served from cache.
     */
    public boolean isCacheable() {
        return this != CONTEXT_UPDATE;
    }

    /**
     * Parses the hyphenated form used by route handlers ("content-generation").
     */
    public static RequestKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            return CONTENT_GENERATION;
        }
        return valueOf(value.trim().toUpperCase().replace('-', '_'));
    }
}
