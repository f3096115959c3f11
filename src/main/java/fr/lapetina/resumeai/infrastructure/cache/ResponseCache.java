package fr.lapetina.resumeai.infrastructure.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Key/value store bounded by time-to-live and entry count.
 *
 * Entries are kept in write order, so the eldest entry by write time is always first.
 * Expired entries are deleted lazily on read and by a periodic sweep; when the cache is
 * over capacity the sweep evicts the oldest entries until {@code maxSize} remain.
 * All operations hold the same lock as the sweep.
 *
 * @param <T> cached value type
 */
public final class ResponseCache<T> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private final String name;
    private final int maxSize;
    private final Duration defaultTtl;
    private final Duration cleanupInterval;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, CacheEntry<T>> entries = new LinkedHashMap<>();
    private long hits;
    private long misses;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledExecutorService scheduler;

    public ResponseCache(String name, int maxSize, Duration defaultTtl, Duration cleanupInterval, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.name = name;
        this.maxSize = maxSize;
        this.defaultTtl = defaultTtl;
        this.cleanupInterval = cleanupInterval;
        this.clock = clock;
    }

    public ResponseCache(CacheCategory category, Clock clock) {
        this(category.key(), category.getDefaultMaxSize(), category.getDefaultTtl(),
                category.getDefaultCleanupInterval(), clock);
    }

    /**
     * Starts the periodic sweep.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "cache-cleanup-" + name);
                t.setDaemon(true);
                return t;
            });
            long intervalMs = cleanupInterval.toMillis();
            scheduler.scheduleAtFixedRate(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            log.info("Cache started: name={}, maxSize={}, defaultTtlMs={}, cleanupIntervalMs={}",
                    name, maxSize, defaultTtl.toMillis(), intervalMs);
        }
    }

    public Optional<T> get(String key) {
        lock.lock();
        try {
            CacheEntry<T> entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (!entry.isValidAt(clock.instant())) {
                entries.remove(key);
                misses++;
                return Optional.empty();
            }
            hits++;
            return Optional.ofNullable(entry.data());
        } finally {
            lock.unlock();
        }
    }

    public void set(String key, T data) {
        set(key, data, defaultTtl);
    }

    /**
     * Stores a value, replacing any previous entry for the key.
     * Runs a cleanup immediately when the cache grows beyond {@code maxSize}.
     */
    public void set(String key, T data, Duration ttl) {
        lock.lock();
        try {
            // Re-insert so the entry moves to the end of write order
            entries.remove(key);
            entries.put(key, new CacheEntry<>(key, data, clock.instant(), ttl));
            if (entries.size() > maxSize) {
                cleanupLocked();
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean has(String key) {
        lock.lock();
        try {
            CacheEntry<T> entry = entries.get(key);
            if (entry == null) {
                return false;
            }
            if (!entry.isValidAt(clock.instant())) {
                entries.remove(key);
                return false;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean delete(String key) {
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deletes every entry whose key starts with the prefix.
     *
     * @return number of entries deleted
     */
    public int deleteByPrefix(String prefix) {
        lock.lock();
        try {
            int removed = 0;
            Iterator<String> it = entries.keySet().iterator();
            while (it.hasNext()) {
                if (it.next().startsWith(prefix)) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
            hits = 0;
            misses = 0;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public List<String> keys() {
        lock.lock();
        try {
            return new ArrayList<>(entries.keySet());
        } finally {
            lock.unlock();
        }
    }

    public CacheStats getStats() {
        lock.lock();
        try {
            return new CacheStats(name, entries.size(), maxSize, hits, misses);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes expired entries, then evicts the oldest entries down to {@code maxSize}.
     *
     * @return number of entries removed
     */
    public int cleanup() {
        lock.lock();
        try {
            return cleanupLocked();
        } finally {
            lock.unlock();
        }
    }

    private int cleanupLocked() {
        Instant now = clock.instant();
        int removed = 0;

        Iterator<Map.Entry<String, CacheEntry<T>>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            if (!it.next().getValue().isValidAt(now)) {
                it.remove();
                removed++;
            }
        }

        it = entries.entrySet().iterator();
        while (entries.size() > maxSize && it.hasNext()) {
            it.next();
            it.remove();
            removed++;
        }

        if (removed > 0) {
            log.debug("Cache cleanup: name={}, removed={}, size={}", name, removed, entries.size());
        }
        return removed;
    }

    private void sweep() {
        try {
            cleanup();
        } catch (RuntimeException e) {
            log.error("Cache sweep failed: name={}", name, e);
        }
    }

    public String getName() {
        return name;
    }

    public int getMaxSize() {
        return maxSize;
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Cache stopped: name={}", name);
        }
    }
}
