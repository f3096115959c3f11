/**
 * Per-provider admission built on the LMAX Disruptor.
 *
 * <p>One scheduler thread consumes a ring buffer of SUBMIT, CANCEL, DRAIN, TICK and CLEAR
 * events and is the only writer of the provider queues. Within a provider queue, requests
 * leave in priority order (HIGH, NORMAL, LOW) and in arrival order within a priority.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.resumeai.admission.AdmissionController} - Publishes events, exposes status</li>
 *   <li>{@link fr.lapetina.resumeai.admission.SchedulerEventHandler} - Queue owner and dispatcher</li>
 *   <li>{@link fr.lapetina.resumeai.admission.RateLimitWindow} - Concurrency and per-minute window of one provider</li>
 *   <li>{@link fr.lapetina.resumeai.admission.OwnerRateLimiter} - Minute and hour budgets per owner, checked on submit</li>
 * </ul>
 */
package fr.lapetina.resumeai.admission;
