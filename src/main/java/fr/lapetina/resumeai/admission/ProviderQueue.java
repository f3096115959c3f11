package fr.lapetina.resumeai.admission;

import fr.lapetina.resumeai.domain.model.Priority;
import fr.lapetina.resumeai.domain.model.QueueEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Waiting requests of one provider, in strict priority buckets.
 *
 * HIGH is served before NORMAL before LOW; within a bucket entries leave in enqueue
 * order. Mutated only by the scheduler thread; {@link #size()} may be read from anywhere.
 */
public final class ProviderQueue {

    private final String provider;
    private final Map<Priority, ArrayDeque<QueueEntry>> buckets = new EnumMap<>(Priority.class);
    private final AtomicInteger size = new AtomicInteger();

    public ProviderQueue(String provider) {
        this.provider = provider;
        for (Priority priority : Priority.values()) {
            buckets.put(priority, new ArrayDeque<>());
        }
    }

    public void add(QueueEntry entry) {
        buckets.get(entry.priority()).addLast(entry);
        size.incrementAndGet();
    }

    /**
     * Head of the highest non-empty bucket, or null.
     */
    public QueueEntry peek() {
        for (Priority priority : Priority.values()) {
            QueueEntry head = buckets.get(priority).peekFirst();
            if (head != null) {
                return head;
            }
        }
        return null;
    }

    public QueueEntry poll() {
        for (Priority priority : Priority.values()) {
            QueueEntry head = buckets.get(priority).pollFirst();
            if (head != null) {
                size.decrementAndGet();
                return head;
            }
        }
        return null;
    }

    public boolean remove(QueueEntry entry) {
        if (buckets.get(entry.priority()).remove(entry)) {
            size.decrementAndGet();
            return true;
        }
        return false;
    }

    /**
     * Removes and returns every entry matching the predicate, in priority order.
     */
    public List<QueueEntry> removeIf(Predicate<QueueEntry> predicate) {
        List<QueueEntry> removed = new ArrayList<>();
        for (Priority priority : Priority.values()) {
            Iterator<QueueEntry> it = buckets.get(priority).iterator();
            while (it.hasNext()) {
                QueueEntry entry = it.next();
                if (predicate.test(entry)) {
                    it.remove();
                    size.decrementAndGet();
                    removed.add(entry);
                }
            }
        }
        return removed;
    }

    public List<QueueEntry> drainAll() {
        return removeIf(entry -> true);
    }

    public int size() {
        return size.get();
    }

    public boolean isEmpty() {
        return size.get() == 0;
    }

    public String getProvider() {
        return provider;
    }
}
