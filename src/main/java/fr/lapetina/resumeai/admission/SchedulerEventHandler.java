package fr.lapetina.resumeai.admission;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.resumeai.domain.event.SchedulerEvent;
import fr.lapetina.resumeai.domain.exception.AiServiceException;
import fr.lapetina.resumeai.domain.model.AiResponse;
import fr.lapetina.resumeai.domain.model.ClassifiedError;
import fr.lapetina.resumeai.domain.model.QueueEntry;
import fr.lapetina.resumeai.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The single scheduler stage: owns every provider queue.
 *
 * Queues are only mutated here, on the Disruptor consumer thread. Windows are shared
 * with fallback permits and synchronize on their own.
 */
public final class SchedulerEventHandler implements EventHandler<SchedulerEvent> {

    private static final Logger log = LoggerFactory.getLogger(SchedulerEventHandler.class);

    private final Map<String, ProviderQueue> queues;
    private final Map<String, RateLimitWindow> windows;
    private final RequestDispatcher dispatcher;
    private final int maxQueueDepth;
    private final Duration queueTimeout;
    private final Clock clock;
    private final MetricsRegistry metrics;

    // Publishes a DRAIN event without blocking
    private volatile Runnable drainRequester = () -> { };

    private final AtomicInteger processing = new AtomicInteger();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public SchedulerEventHandler(
            Map<String, ProviderQueue> queues,
            Map<String, RateLimitWindow> windows,
            RequestDispatcher dispatcher,
            int maxQueueDepth,
            Duration queueTimeout,
            Clock clock,
            MetricsRegistry metrics
    ) {
        this.queues = queues;
        this.windows = windows;
        this.dispatcher = dispatcher;
        this.maxQueueDepth = maxQueueDepth;
        this.queueTimeout = queueTimeout;
        this.clock = clock;
        this.metrics = metrics;
        log.info("SchedulerEventHandler initialized: providers={}, maxQueueDepth={}, queueTimeoutMs={}",
                queues.keySet(), maxQueueDepth, queueTimeout.toMillis());
    }

    void setDrainRequester(Runnable drainRequester) {
        this.drainRequester = drainRequester;
    }

    @Override
    public void onEvent(SchedulerEvent event, long sequence, boolean endOfBatch) {
        switch (event.getType()) {
            case SUBMIT -> onSubmit(event.getEntry());
            case CANCEL -> onCancel(event.getEntry());
            case DRAIN -> drainAll();
            case TICK -> {
                expireAll();
                drainAll();
            }
            case CLEAR -> clearAll();
        }

        CompletableFuture<Void> ack = event.getAck();
        event.clear();
        if (ack != null) {
            ack.complete(null);
        }
    }

    private void onSubmit(QueueEntry entry) {
        try (MDC.MDCCloseable ignoredRequest = MDC.putCloseable("requestId", entry.requestId());
             MDC.MDCCloseable ignoredProvider = MDC.putCloseable("provider", entry.provider());
             MDC.MDCCloseable ignoredOwner = MDC.putCloseable("ownerId", entry.request().ownerId())) {

            if (entry.isDone()) {
                log.debug("Request finished before scheduling: requestId={}", entry.requestId());
                return;
            }

            ProviderQueue queue = queues.get(entry.provider());
            if (queue.size() >= maxQueueDepth) {
                log.warn("Request rejected, queue full: requestId={}, provider={}, depth={}",
                        entry.requestId(), entry.provider(), queue.size());
                reject(entry, ClassifiedError.queueFull(entry.provider(), entry.requestId(),
                        "Queue for " + entry.provider() + " is full (" + maxQueueDepth + " waiting)",
                        clock.instant()));
                return;
            }

            queue.add(entry);
            log.debug("Request enqueued: requestId={}, provider={}, priority={}, depth={}",
                    entry.requestId(), entry.provider(), entry.priority(), queue.size());
        }
        drain(entry.provider());
    }

    private void onCancel(QueueEntry entry) {
        ProviderQueue queue = queues.get(entry.provider());
        if (queue != null && queue.remove(entry)) {
            log.info("Queued request cancelled: requestId={}, provider={}", entry.requestId(), entry.provider());
        }
    }

    private void drainAll() {
        for (String provider : queues.keySet()) {
            drain(provider);
        }
    }

    /**
     * Admits waiting requests in priority order until the window refuses.
     */
    private void drain(String provider) {
        ProviderQueue queue = queues.get(provider);
        RateLimitWindow window = windows.get(provider);
        Instant now = clock.instant();

        while (true) {
            QueueEntry head = queue.peek();
            if (head == null) {
                return;
            }
            if (head.isDone()) {
                queue.poll();
                continue;
            }
            if (head.hasWaitedLongerThan(queueTimeout, now)) {
                queue.poll();
                expire(head, now);
                continue;
            }
            if (!window.tryAcquire()) {
                log.debug("Provider at capacity, requests wait: provider={}, waiting={}, window={}",
                        provider, queue.size(), window);
                return;
            }
            queue.poll();
            dispatch(head, window);
        }
    }

    private void dispatch(QueueEntry entry, RateLimitWindow window) {
        Instant now = clock.instant();
        entry.markDispatched(now);
        processing.incrementAndGet();

        try (MDC.MDCCloseable ignoredRequest = MDC.putCloseable("requestId", entry.requestId());
             MDC.MDCCloseable ignoredProvider = MDC.putCloseable("provider", entry.provider());
             MDC.MDCCloseable ignoredOwner = MDC.putCloseable("ownerId", entry.request().ownerId())) {
            log.info("Request admitted: requestId={}, provider={}, priority={}, waitedMs={}, window={}",
                    entry.requestId(), entry.provider(), entry.priority(),
                    entry.waited(now).toMillis(), window);
        }

        CompletableFuture<AiResponse> attempt;
        try {
            attempt = dispatcher.dispatch(entry.request(), entry.provider(), entry::isCancelled);
        } catch (RuntimeException e) {
            attempt = CompletableFuture.failedFuture(e);
        }
        attempt.whenComplete((response, ex) -> onDispatchComplete(entry, window, response, ex));
    }

    /**
     * Runs on whichever thread finished the attempt sequence. Releases the admission slot
     * before completing the caller's future.
     */
    private void onDispatchComplete(QueueEntry entry, RateLimitWindow window, AiResponse response, Throwable ex) {
        window.release();
        processing.decrementAndGet();

        if (ex == null) {
            completed.incrementAndGet();
            entry.future().complete(response);
        } else {
            failed.incrementAndGet();
            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
            entry.future().completeExceptionally(cause);
        }

        drainRequester.run();
    }

    private void expireAll() {
        Instant now = clock.instant();
        for (ProviderQueue queue : queues.values()) {
            List<QueueEntry> removed = queue.removeIf(e -> e.isDone() || e.hasWaitedLongerThan(queueTimeout, now));
            for (QueueEntry entry : removed) {
                if (!entry.isDone()) {
                    expire(entry, now);
                }
            }
        }
    }

    private void expire(QueueEntry entry, Instant now) {
        log.warn("Request timed out in queue: requestId={}, provider={}, waitedMs={}",
                entry.requestId(), entry.provider(), entry.waited(now).toMillis());
        reject(entry, ClassifiedError.queueTimeout(entry.provider(), entry.requestId(), entry.waited(now), now));
    }

    private void clearAll() {
        int cleared = 0;
        for (ProviderQueue queue : queues.values()) {
            for (QueueEntry entry : queue.drainAll()) {
                if (!entry.isDone()) {
                    entry.future().completeExceptionally(new AiServiceException(
                            ClassifiedError.queueFull(entry.provider(), entry.requestId(),
                                    "Queue cleared", clock.instant())));
                    cleared++;
                }
            }
        }
        completed.set(0);
        failed.set(0);
        log.info("Queues cleared: failedEntries={}", cleared);
    }

    private void reject(QueueEntry entry, ClassifiedError error) {
        metrics.incrementRejected(entry.provider(), error.code());
        entry.future().completeExceptionally(new AiServiceException(error));
    }

    public QueueStatus getStatus() {
        int pending = queues.values().stream().mapToInt(ProviderQueue::size).sum();
        long done = completed.get();
        long failures = failed.get();
        return new QueueStatus(pending, processing.get(), done, failures, done + failures);
    }
}
