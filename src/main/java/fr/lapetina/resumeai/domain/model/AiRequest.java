package fr.lapetina.resumeai.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A unit of work destined for an LLM provider.
 * Immutable and thread-safe.
 *
 * @param preferredProvider provider to try first instead of the head of the fallback order, may be null
 */
public record AiRequest(
        String id,
        RequestKind kind,
        String prompt,
        Map<String, Object> context,
        String ownerId,
        Priority priority,
        Instant submittedAt,
        String preferredProvider,
        Map<String, Object> metadata
) {
    public AiRequest {
        Objects.requireNonNull(ownerId, "Owner ID is required");
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt is required");
        }
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (kind == null) {
            kind = RequestKind.CONTENT_GENERATION;
        }
        if (priority == null) {
            priority = Priority.NORMAL;
        }
        if (submittedAt == null) {
            submittedAt = Instant.now();
        }
        // Opaque maps may carry null values, which Map.copyOf rejects
        context = context != null ? Collections.unmodifiableMap(new LinkedHashMap<>(context)) : Map.of();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    /**
     * Creates a normal-priority request of the given kind.
     */
    public static AiRequest of(RequestKind kind, String ownerId, String prompt) {
        return new AiRequest(null, kind, prompt, null, ownerId, null, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private RequestKind kind;
        private String prompt;
        private Map<String, Object> context;
        private String ownerId;
        private Priority priority;
        private Instant submittedAt;
        private String preferredProvider;
        private Map<String, Object> metadata;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(RequestKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder context(Map<String, Object> context) {
            this.context = context;
            return this;
        }

        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public Builder preferredProvider(String preferredProvider) {
            this.preferredProvider = preferredProvider;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public AiRequest build() {
            return new AiRequest(
                    id, kind, prompt, context, ownerId, priority,
                    submittedAt, preferredProvider, metadata
            );
        }
    }
}
