package fr.lapetina.resumeai.domain.event;

import fr.lapetina.resumeai.domain.model.QueueEntry;

import java.util.concurrent.CompletableFuture;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * Mutable holder reused across the ring buffer. It should never be accessed outside
 * the scheduler handler.
 */
public final class SchedulerEvent {

    private SchedulerEventType type;
    private QueueEntry entry;

    // Completed by the handler once the event is processed, may be null
    private CompletableFuture<Void> ack;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.type = null;
        this.entry = null;
        this.ack = null;
    }

    public void initialize(SchedulerEventType type, QueueEntry entry, CompletableFuture<Void> ack) {
        clear();
        this.type = type;
        this.entry = entry;
        this.ack = ack;
    }

    public SchedulerEventType getType() {
        return type;
    }

    public QueueEntry getEntry() {
        return entry;
    }

    public CompletableFuture<Void> getAck() {
        return ack;
    }

    @Override
    public String toString() {
        return "SchedulerEvent{" +
                "type=" + type +
                ", requestId=" + (entry != null ? entry.requestId() : "null") +
                '}';
    }
}
