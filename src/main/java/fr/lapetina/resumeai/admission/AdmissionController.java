package fr.lapetina.resumeai.admission;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.resumeai.domain.event.SchedulerEvent;
import fr.lapetina.resumeai.domain.event.SchedulerEventFactory;
import fr.lapetina.resumeai.domain.event.SchedulerEventType;
import fr.lapetina.resumeai.domain.exception.AiServiceException;
import fr.lapetina.resumeai.domain.model.AiRequest;
import fr.lapetina.resumeai.domain.model.AiResponse;
import fr.lapetina.resumeai.domain.model.ClassifiedError;
import fr.lapetina.resumeai.domain.model.ErrorCode;
import fr.lapetina.resumeai.domain.model.QueueEntry;
import fr.lapetina.resumeai.infrastructure.config.OrchestratorConfig;
import fr.lapetina.resumeai.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.resumeai.resilience.ProviderPermits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Per-provider admission: concurrency and per-minute limits, priority queueing and dispatch.
 *
 * Every queue mutation happens on one scheduler thread, the consumer of an LMAX Disruptor
 * ring buffer. Callers publish SUBMIT events with a non-blocking {@code tryNext()}, so
 * {@link #submit(AiRequest)} never blocks; a full ring buffer fails the request with
 * QUEUE_FULL. Slot releases publish a DRAIN event, and a scheduled TICK expires entries
 * that waited longer than the queue timeout and admits requests whose window has reset.
 *
 * The controller also hands out permits from the same windows to the fallback controller,
 * for attempts on providers other than the one a request was admitted to.
 */
public final class AdmissionController implements ProviderPermits, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    private final Disruptor<SchedulerEvent> disruptor;
    private final RingBuffer<SchedulerEvent> ringBuffer;
    private final SchedulerEventHandler handler;
    private final Map<String, RateLimitWindow> windows;
    private final Map<String, ProviderQueue> queues;
    private final String defaultProvider;
    private final Duration dispatchInterval;
    private final Clock clock;
    private final MetricsRegistry metrics;
    private final OwnerRateLimiter ownerLimiter;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledExecutorService ticker;

    private AdmissionController(Builder builder) {
        this.clock = builder.clock;
        this.metrics = builder.metricsRegistry;
        this.dispatchInterval = builder.dispatchInterval;
        this.defaultProvider = builder.providerOrder.get(0);
        this.ownerLimiter = builder.ownerRequestsPerMinute > 0
                ? new OwnerRateLimiter(builder.ownerRequestsPerMinute, builder.ownerRequestsPerHour, clock)
                : OwnerRateLimiter.disabled(clock);

        Map<String, RateLimitWindow> windowMap = new LinkedHashMap<>();
        Map<String, ProviderQueue> queueMap = new LinkedHashMap<>();
        for (ProviderLimits limits : builder.limits.values()) {
            windowMap.put(limits.provider(), new RateLimitWindow(
                    limits.provider(), limits.requestsPerMinute(), limits.concurrentRequests(), clock));
            queueMap.put(limits.provider(), new ProviderQueue(limits.provider()));
        }
        this.windows = Map.copyOf(windowMap);
        this.queues = Map.copyOf(queueMap);

        // Windows are in place, so this controller can already serve as fallback permits
        RequestDispatcher dispatcher = builder.dispatcherFactory.apply(this);
        this.handler = new SchedulerEventHandler(
                queues, windows, dispatcher,
                builder.maxQueueDepth, builder.queueTimeout, clock, metrics);

        this.disruptor = new Disruptor<>(
                new SchedulerEventFactory(),
                builder.ringBufferSize,
                new SchedulerThreadFactory("admission-scheduler"),
                ProducerType.MULTI, // Callers and completion threads publish concurrently
                createWaitStrategy(builder.waitStrategy)
        );
        disruptor.handleEventsWith(handler);
        disruptor.setDefaultExceptionHandler(new SchedulerExceptionHandler());
        this.ringBuffer = disruptor.getRingBuffer();

        handler.setDrainRequester(this::requestDrain);

        for (String provider : queues.keySet()) {
            metrics.registerQueueDepth(provider, queues.get(provider)::size);
            metrics.registerActiveRequests(provider, windows.get(provider)::getActiveConcurrent);
        }

        log.info("AdmissionController created: providers={}, ringBufferSize={}, waitStrategy={}, "
                        + "maxQueueDepth={}, queueTimeoutMs={}, dispatchIntervalMs={}, ownerLimits={}",
                windows.values(), builder.ringBufferSize, builder.waitStrategy,
                builder.maxQueueDepth, builder.queueTimeout.toMillis(), dispatchInterval.toMillis(),
                ownerLimiter.isEnabled()
                        ? ownerLimiter.getRequestsPerMinute() + "/min," + ownerLimiter.getRequestsPerHour() + "/h"
                        : "off");
    }

    /**
     * Starts the scheduler thread and the periodic tick.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            ticker = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "admission-ticker");
                t.setDaemon(true);
                return t;
            });
            long intervalMs = dispatchInterval.toMillis();
            ticker.scheduleAtFixedRate(this::publishTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            log.info("AdmissionController started");
        }
    }

    /**
     * Submits a request for admission. Never blocks.
     *
     * The admission provider is the request's preferred provider, or the head of the
     * fallback order. The owner's minute and hour budgets are checked before the ring
     * buffer; a request over budget fails with RATE_LIMIT_EXCEEDED and the window reset.
     * Cancelling the returned future removes a still-queued request; once
     * dispatched, cancellation only prevents further attempts.
     *
     * @return future completed with the response, or failed with {@link AiServiceException}
     */
    public CompletableFuture<AiResponse> submit(AiRequest request) {
        CompletableFuture<AiResponse> future = new CompletableFuture<>();
        Instant now = clock.instant();

        if (!running.get()) {
            future.completeExceptionally(new IllegalStateException("Admission controller not running"));
            return future;
        }

        String provider = request.preferredProvider() != null ? request.preferredProvider() : defaultProvider;
        if (!windows.containsKey(provider)) {
            log.warn("Request rejected, unknown provider: requestId={}, provider={}", request.id(), provider);
            future.completeExceptionally(new AiServiceException(ClassifiedError.of(
                    ErrorCode.INVALID_REQUEST, provider, request.id(), "Unknown provider: " + provider, now)));
            return future;
        }

        Optional<ClassifiedError> ownerRejection = ownerLimiter.tryAcquire(request.ownerId(), request.id());
        if (ownerRejection.isPresent()) {
            metrics.incrementRejected(provider, ErrorCode.RATE_LIMIT_EXCEEDED);
            future.completeExceptionally(new AiServiceException(ownerRejection.get()));
            return future;
        }

        QueueEntry entry = new QueueEntry(request, provider, now, future);

        // Try to claim a slot in the ring buffer
        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            log.warn("Request rejected, ring buffer full: requestId={}, provider={}, remainingCapacity={}",
                    request.id(), provider, ringBuffer.remainingCapacity());
            metrics.incrementRejected(provider, ErrorCode.QUEUE_FULL);
            future.completeExceptionally(new AiServiceException(ClassifiedError.queueFull(
                    provider, request.id(), "Scheduler ring buffer full", now)));
            return future;
        }

        try {
            ringBuffer.get(sequence).initialize(SchedulerEventType.SUBMIT, entry, null);
        } finally {
            ringBuffer.publish(sequence);
        }

        future.whenComplete((response, ex) -> {
            if (future.isCancelled() && !entry.isDispatched()) {
                publishCancel(entry);
            }
        });

        log.debug("Request submitted: requestId={}, provider={}, priority={}, sequence={}",
                request.id(), provider, request.priority(), sequence);
        return future;
    }

    /**
     * Runs one scheduler tick: expires timed-out entries, then drains every queue.
     *
     * @return completed once the scheduler has processed the tick
     */
    public CompletableFuture<Void> tick() {
        return publishAcknowledged(SchedulerEventType.TICK);
    }

    /**
     * Fails every queued request with QUEUE_FULL and resets the completion counters.
     *
     * @return completed once the queues are empty
     */
    public CompletableFuture<Void> clearQueue() {
        return publishAcknowledged(SchedulerEventType.CLEAR);
    }

    public QueueStatus getStatus() {
        return handler.getStatus();
    }

    public Optional<RateLimitStatus> getRateLimitStatus(String provider) {
        return Optional.ofNullable(windows.get(provider)).map(RateLimitWindow::snapshot);
    }

    public Map<String, RateLimitStatus> getRateLimitStatuses() {
        Map<String, RateLimitStatus> statuses = new LinkedHashMap<>();
        windows.keySet().stream().sorted().forEach(p -> statuses.put(p, windows.get(p).snapshot()));
        return statuses;
    }

    /**
     * Remaining minute and hour budget of one owner.
     */
    public OwnerRateLimitStatus getOwnerRateLimitStatus(String ownerId) {
        return ownerLimiter.status(ownerId);
    }

    public int getQueueDepth(String provider) {
        ProviderQueue queue = queues.get(provider);
        return queue != null ? queue.size() : 0;
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    // ProviderPermits

    @Override
    public boolean tryAcquire(String provider) {
        RateLimitWindow window = windows.get(provider);
        return window == null || window.tryAcquire();
    }

    @Override
    public void release(String provider) {
        RateLimitWindow window = windows.get(provider);
        if (window != null) {
            window.release();
            requestDrain();
        }
    }

    @Override
    public Optional<Instant> resetAt(String provider) {
        return Optional.ofNullable(windows.get(provider)).map(RateLimitWindow::resetAt);
    }

    private void requestDrain() {
        if (!running.get()) {
            return;
        }
        boolean published = ringBuffer.tryPublishEvent(
                (event, seq) -> event.initialize(SchedulerEventType.DRAIN, null, null));
        if (!published) {
            log.debug("Ring buffer full, drain deferred to next tick");
        }
    }

    private void publishCancel(QueueEntry entry) {
        if (!running.get()) {
            return;
        }
        boolean published = ringBuffer.tryPublishEvent(
                (event, seq) -> event.initialize(SchedulerEventType.CANCEL, entry, null));
        if (!published) {
            log.debug("Ring buffer full, cancelled entry left for lazy removal: requestId={}", entry.requestId());
        }
    }

    private void publishTick() {
        try {
            if (!ringBuffer.tryPublishEvent((event, seq) -> event.initialize(SchedulerEventType.TICK, null, null))) {
                log.debug("Ring buffer full, tick skipped");
            }
            ownerLimiter.evictIdle();
        } catch (RuntimeException e) {
            log.error("Failed to publish scheduler tick", e);
        }
    }

    private CompletableFuture<Void> publishAcknowledged(SchedulerEventType type) {
        CompletableFuture<Void> ack = new CompletableFuture<>();
        if (!running.get()) {
            ack.completeExceptionally(new IllegalStateException("Admission controller not running"));
            return ack;
        }
        ringBuffer.publishEvent((event, seq) -> event.initialize(type, null, ack));
        return ack;
    }

    /**
     * Stops the tick and the scheduler thread. Queued requests are left unanswered.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down AdmissionController...");
            ticker.shutdownNow();
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("AdmissionController shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("AdmissionController shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Admission limits of one provider.
     */
    public record ProviderLimits(String provider, int requestsPerMinute, int concurrentRequests) {
    }

    /**
     * Thread factory for the scheduler thread.
     */
    private static class SchedulerThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        SchedulerThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Fails the affected request, or the waiting acknowledgement, when the handler throws.
     */
    private static class SchedulerExceptionHandler implements ExceptionHandler<SchedulerEvent> {

        private static final Logger log = LoggerFactory.getLogger(SchedulerExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, SchedulerEvent event) {
            log.error("Exception in scheduler: sequence={}, event={}", sequence, event, ex);

            if (event.getEntry() != null && !event.getEntry().isDone()) {
                event.getEntry().future().completeExceptionally(ex);
            }
            if (event.getAck() != null && !event.getAck().isDone()) {
                event.getAck().completeExceptionally(ex);
            }
            event.clear();
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during scheduler start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during scheduler shutdown", ex);
        }
    }

    /**
     * Builder for AdmissionController.
     */
    public static final class Builder {
        private final Map<String, ProviderLimits> limits = new LinkedHashMap<>();
        private List<String> providerOrder;
        private Function<ProviderPermits, RequestDispatcher> dispatcherFactory;
        private MetricsRegistry metricsRegistry;
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int maxQueueDepth = 100;
        private Duration queueTimeout = Duration.ofSeconds(30);
        private Duration dispatchInterval = Duration.ofSeconds(1);
        private Clock clock = Clock.systemUTC();
        private int ownerRequestsPerMinute;
        private int ownerRequestsPerHour;

        public Builder provider(String name, int requestsPerMinute, int concurrentRequests) {
            limits.put(name, new ProviderLimits(name, requestsPerMinute, concurrentRequests));
            return this;
        }

        public Builder providerOrder(List<String> providerOrder) {
            this.providerOrder = providerOrder;
            return this;
        }

        public Builder dispatcher(RequestDispatcher dispatcher) {
            this.dispatcherFactory = permits -> dispatcher;
            return this;
        }

        /**
         * Dispatcher that takes fallback permits from the controller being built.
         */
        public Builder dispatcher(Function<ProviderPermits, RequestDispatcher> dispatcherFactory) {
            this.dispatcherFactory = dispatcherFactory;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder maxQueueDepth(int maxQueueDepth) {
            this.maxQueueDepth = maxQueueDepth;
            return this;
        }

        public Builder queueTimeout(Duration queueTimeout) {
            this.queueTimeout = queueTimeout;
            return this;
        }

        public Builder dispatchInterval(Duration dispatchInterval) {
            this.dispatchInterval = dispatchInterval;
            return this;
        }

        /**
         * Enables per-owner limits. Owners are unlimited unless this is set.
         */
        public Builder ownerLimits(int requestsPerMinute, int requestsPerHour) {
            if (requestsPerMinute <= 0 || requestsPerHour <= 0) {
                throw new IllegalArgumentException("Owner limits must be greater than 0");
            }
            this.ownerRequestsPerMinute = requestsPerMinute;
            this.ownerRequestsPerHour = requestsPerHour;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder fromConfig(OrchestratorConfig config) {
            for (OrchestratorConfig.ProviderConfig provider : config.getProviders()) {
                if (provider.isEnabled()) {
                    provider(provider.getName(), provider.getRequestsPerMinute(), provider.getConcurrentRequests());
                }
            }
            this.providerOrder = config.getEnabledProviderOrder();
            ringBufferSize(config.getQueue().getRingBufferSize());
            this.waitStrategy = config.getQueue().getWaitStrategy();
            this.maxQueueDepth = config.getQueue().getMaxQueueDepth();
            this.queueTimeout = Duration.ofMillis(config.getQueue().getQueueTimeoutMs());
            this.dispatchInterval = Duration.ofMillis(config.getQueue().getDispatchIntervalMs());
            OrchestratorConfig.OwnerLimitsConfig owner = config.getOwnerLimits();
            if (owner.isEnabled()) {
                ownerLimits(owner.getRequestsPerMinute(), owner.getRequestsPerHour());
            }
            return this;
        }

        public AdmissionController build() {
            if (limits.isEmpty()) {
                throw new IllegalStateException("At least one provider is required");
            }
            if (providerOrder == null || providerOrder.isEmpty()) {
                throw new IllegalStateException("Provider order is required");
            }
            if (!limits.keySet().containsAll(providerOrder)) {
                throw new IllegalStateException("Provider order names unconfigured providers: " + providerOrder);
            }
            if (dispatcherFactory == null) {
                throw new IllegalStateException("RequestDispatcher is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new AdmissionController(this);
        }
    }
}
