package fr.lapetina.resumeai.admission;

/**
 * Admission counters at a point in time.
 *
 * @param pending        requests waiting in provider queues
 * @param processing     requests dispatched and not yet finished
 * @param totalProcessed completed plus failed since the last clear
 */
public record QueueStatus(int pending, int processing, long completed, long failed, long totalProcessed) {
}
