package com.ryuqq.handover.core.spi;

import com.ryuqq.handover.core.contract.StepEnvelope;
import com.ryuqq.handover.core.outcome.Fail;

import java.util.List;

/**
 * Message Queue SPI for deferred step execution.
 *
 * <p>This interface is the durable work queue behind every deferred handover step.
 * Polling an external job is expressed as re-publishing the same step with a delay,
 * never as a worker sleeping.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Publishing envelopes to the queue with optional delay</li>
 *   <li>Dequeuing batches of envelopes for processing</li>
 *   <li>Acknowledging successfully processed messages</li>
 *   <li>Negative acknowledging failed messages for redelivery</li>
 *   <li>Publishing permanently failed messages to Dead Letter Queue (DLQ)</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Idempotent: ack/nack operations should be idempotent</li>
 *   <li>Visibility Timeout: dequeued messages stay invisible until ack/nack or timeout</li>
 *   <li>At-least-once Delivery: Messages may be delivered multiple times</li>
 *   <li>Durability: production implementations must survive process restarts</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * // Re-check a running job in one minute
 * bus.publish(envelope.nextPoll(), 60_000L);
 *
 * List&lt;StepEnvelope&gt; batch = bus.dequeue(10);
 * for (StepEnvelope envelope : batch) {
 *     try {
 *         process(envelope);
 *         bus.ack(envelope);
 *     } catch (Exception e) {
 *         bus.nack(envelope);
 *     }
 * }
 * </pre>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public interface Bus {

    /**
     * Publishes an envelope with optional delay.
     *
     * <p>Non-blocking; returns once the message is queued.</p>
     *
     * @param envelope the envelope to publish
     * @param delayMs delay in milliseconds before the message becomes available (0 for immediate)
     * @throws IllegalArgumentException if envelope is null or delayMs is negative
     */
    void publish(StepEnvelope envelope, long delayMs);

    /**
     * Dequeues up to {@code batchSize} envelopes whose delay has expired.
     *
     * @param batchSize maximum number of messages to retrieve
     * @return dequeued envelopes (may be empty)
     * @throws IllegalArgumentException if batchSize is not positive
     */
    List<StepEnvelope> dequeue(int batchSize);

    /**
     * Acknowledges successful processing, permanently removing the message.
     *
     * @param envelope the envelope to acknowledge
     * @throws IllegalArgumentException if envelope is null
     */
    void ack(StepEnvelope envelope);

    /**
     * Returns a dequeued envelope to the queue for immediate redelivery.
     *
     * @param envelope the envelope to negative acknowledge
     * @throws IllegalArgumentException if envelope is null
     */
    void nack(StepEnvelope envelope);

    /**
     * Moves a permanently failed envelope to the Dead Letter Queue.
     *
     * <p><strong>DLQ Scenarios:</strong></p>
     * <ul>
     *   <li>Delivery attempts exhausted after repeated infrastructure failures</li>
     *   <li>Non-retryable failure (e.g., malformed completion report)</li>
     *   <li>No handler registered for the step</li>
     * </ul>
     *
     * @param envelope the envelope that permanently failed
     * @param fail the failure details
     * @throws IllegalArgumentException if envelope or fail is null
     */
    void publishToDLQ(StepEnvelope envelope, Fail fail);
}
