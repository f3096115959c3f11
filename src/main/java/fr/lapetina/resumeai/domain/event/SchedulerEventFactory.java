package fr.lapetina.resumeai.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for creating SchedulerEvent instances in the Disruptor ring buffer.
 *
 * The Disruptor pre-allocates events at startup; they are reused by clearing and
 * re-initializing them.
 */
public final class SchedulerEventFactory implements EventFactory<SchedulerEvent> {

    @Override
    public SchedulerEvent newInstance() {
        return new SchedulerEvent();
    }
}
