package fr.lapetina.resumeai.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * An admitted-or-waiting request together with the caller's future.
 *
 * Exactly one entry exists per outstanding request. It leaves its provider queue on
 * dispatch, cancellation or queue timeout.
 */
public final class QueueEntry {

    private final AiRequest request;
    private final String provider;
    private final Instant enqueuedAt;
    private final CompletableFuture<AiResponse> future;
    private volatile Instant dispatchedAt;

    public QueueEntry(AiRequest request, String provider, Instant enqueuedAt, CompletableFuture<AiResponse> future) {
        this.request = Objects.requireNonNull(request, "Request is required");
        this.provider = Objects.requireNonNull(provider, "Provider is required");
        this.enqueuedAt = Objects.requireNonNull(enqueuedAt, "Enqueue time is required");
        this.future = Objects.requireNonNull(future, "Future is required");
    }

    public AiRequest request() {
        return request;
    }

    public String requestId() {
        return request.id();
    }

    public Priority priority() {
        return request.priority();
    }

    /**
     * Provider whose admission window this entry waits on.
     */
    public String provider() {
        return provider;
    }

    public Instant enqueuedAt() {
        return enqueuedAt;
    }

    public CompletableFuture<AiResponse> future() {
        return future;
    }

    public boolean isDone() {
        return future.isDone();
    }

    public boolean isCancelled() {
        return future.isCancelled();
    }

    public boolean isDispatched() {
        return dispatchedAt != null;
    }

    public void markDispatched(Instant now) {
        this.dispatchedAt = now;
    }

    public Duration waited(Instant now) {
        return Duration.between(enqueuedAt, now);
    }

    public boolean hasWaitedLongerThan(Duration timeout, Instant now) {
        return waited(now).compareTo(timeout) > 0;
    }

    @Override
    public String toString() {
        return "QueueEntry{requestId=" + request.id()
                + ", provider=" + provider
                + ", priority=" + request.priority()
                + ", enqueuedAt=" + enqueuedAt
                + ", dispatched=" + isDispatched()
                + '}';
    }
}
