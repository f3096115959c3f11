package fr.lapetina.resumeai.domain.event;

/**
 * Kinds of work handed to the admission scheduler thread.
 */
public enum SchedulerEventType {
    /** A new request to enqueue and, capacity permitting, dispatch */
    SUBMIT,

    /** A slot was released: admit waiting requests */
    DRAIN,

    /** The caller cancelled a request that may still be queued */
    CANCEL,

    /** Periodic expiry of timed-out entries followed by a drain */
    TICK,

    /** Fail every queued request and reset the counters */
    CLEAR
}
