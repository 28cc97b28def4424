package com.ryuqq.handover.application.runtime;

/**
 * Deferred step runtime.
 *
 * <p>Drains the step queue and dispatches each envelope to the handler
 * registered for its step name.</p>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * pump()
 *   1. Dequeue a batch of envelopes from the Bus
 *   2. For each envelope, run the StepHandler for its StepName
 *   3. Apply the StepOutcome:
 *      - Advance    → enqueue next step with the new payload
 *      - Reschedule → republish the same task after the delay (pollCount + 1)
 *      - Finish     → nothing further
 *   4. Ack the envelope
 *   On exception:
 *      - retryable and attempts left → republish with backoff (failureCount + 1)
 *      - otherwise → publish to DLQ with a Fail
 * </pre>
 *
 * <p>No worker ever sleeps waiting for an external job; waiting is always a
 * delayed publish.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
 * scheduler.scheduleWithFixedDelay(runtime::pump, 0, 100, TimeUnit.MILLISECONDS);
 * </pre>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Executes a single pump cycle: dequeue, dispatch, acknowledge.
     *
     * <p>Returns once the dequeued batch has been handled, or immediately if
     * the queue is empty. The caller is responsible for invoking it
     * repeatedly.</p>
     *
     * @throws IllegalStateException if the runtime has been shut down
     */
    void pump();
}
