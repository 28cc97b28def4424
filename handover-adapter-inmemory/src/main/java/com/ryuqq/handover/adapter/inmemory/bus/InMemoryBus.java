package com.ryuqq.handover.adapter.inmemory.bus;

import com.ryuqq.handover.core.contract.StepEnvelope;
import com.ryuqq.handover.core.outcome.Fail;
import com.ryuqq.handover.core.spi.Bus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;

/**
 * In-memory {@link Bus} for tests and single-process deployments.
 *
 * <p>Contents are lost when the process exits; a durable broker adapter is
 * required for handovers to survive restarts.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Main Queue:</strong> DelayQueue - envelopes become visible once their delay expires</li>
 *   <li><strong>In-Flight:</strong> envelope → visibility deadline; unacked envelopes return to the queue after it</li>
 *   <li><strong>Dead Letter Queue:</strong> envelopes that exhausted redelivery, with their Fail</li>
 * </ul>
 *
 * <p>In-flight entries are keyed by the envelope value, not the task id: a
 * rescheduled poll of the same task is published before the previous delivery
 * is acked, and both may be in flight at once.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class InMemoryBus implements Bus {

    private static final long DEFAULT_VISIBILITY_TIMEOUT_MS = 30_000L;

    private final DelayQueue<DelayedEnvelope> queue;
    private final Map<StepEnvelope, Long> inFlight;
    private final List<DeadLetter> dlq;
    private final long visibilityTimeoutMs;

    public InMemoryBus() {
        this(DEFAULT_VISIBILITY_TIMEOUT_MS);
    }

    /**
     * @param visibilityTimeoutMs how long a dequeued envelope stays invisible
     * @throws IllegalArgumentException if visibilityTimeoutMs is not positive
     */
    public InMemoryBus(long visibilityTimeoutMs) {
        if (visibilityTimeoutMs <= 0) {
            throw new IllegalArgumentException("visibilityTimeoutMs must be positive, but was: " + visibilityTimeoutMs);
        }
        this.queue = new DelayQueue<>();
        this.inFlight = new ConcurrentHashMap<>();
        this.dlq = new CopyOnWriteArrayList<>();
        this.visibilityTimeoutMs = visibilityTimeoutMs;
    }

    @Override
    public void publish(StepEnvelope envelope, long delayMs) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative, but was: " + delayMs);
        }
        queue.put(new DelayedEnvelope(envelope, delayMs));
    }

    @Override
    public List<StepEnvelope> dequeue(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }

        List<StepEnvelope> result = new ArrayList<>();
        long deadline = System.currentTimeMillis() + visibilityTimeoutMs;
        for (int i = 0; i < batchSize; i++) {
            DelayedEnvelope delayed = queue.poll();
            if (delayed == null) {
                break;
            }
            inFlight.put(delayed.envelope, deadline);
            result.add(delayed.envelope);
        }
        return result;
    }

    @Override
    public void ack(StepEnvelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        inFlight.remove(envelope);
    }

    @Override
    public void nack(StepEnvelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        inFlight.remove(envelope);
        publish(envelope, 0);
    }

    @Override
    public void publishToDLQ(StepEnvelope envelope, Fail fail) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        if (fail == null) {
            throw new IllegalArgumentException("fail cannot be null");
        }
        inFlight.remove(envelope);
        dlq.add(new DeadLetter(envelope, fail, System.currentTimeMillis()));
    }

    /**
     * Returns in-flight envelopes whose visibility deadline has passed to the queue.
     *
     * @return number of envelopes returned
     */
    public int processVisibilityTimeouts() {
        long now = System.currentTimeMillis();
        int count = 0;
        for (Map.Entry<StepEnvelope, Long> entry : inFlight.entrySet()) {
            if (entry.getValue() <= now && inFlight.remove(entry.getKey(), entry.getValue())) {
                publish(entry.getKey(), 0);
                count++;
            }
        }
        return count;
    }

    /**
     * Expires the visibility timeout of one envelope immediately.
     *
     * @return true if the envelope was in flight
     */
    public boolean expireVisibilityTimeout(StepEnvelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        if (inFlight.remove(envelope) != null) {
            publish(envelope, 0);
            return true;
        }
        return false;
    }

    public void clear() {
        queue.clear();
        inFlight.clear();
        dlq.clear();
    }

    /**
     * Envelopes waiting in the queue, including those whose delay has not expired.
     */
    public int queueSize() {
        return queue.size();
    }

    public int inFlightSize() {
        return inFlight.size();
    }

    public int dlqSize() {
        return dlq.size();
    }

    public List<DeadLetter> getDeadLetters() {
        return new ArrayList<>(dlq);
    }

    private static final class DelayedEnvelope implements Delayed {

        private final StepEnvelope envelope;
        private final long availableAt;

        DelayedEnvelope(StepEnvelope envelope, long delayMs) {
            this.envelope = envelope;
            this.availableAt = System.currentTimeMillis() + delayMs;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(availableAt - System.currentTimeMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }
    }

    /**
     * Dead-lettered envelope with its failure and the time it was parked.
     */
    public static final class DeadLetter {

        private final StepEnvelope envelope;
        private final Fail fail;
        private final long timestamp;

        DeadLetter(StepEnvelope envelope, Fail fail, long timestamp) {
            this.envelope = envelope;
            this.fail = fail;
            this.timestamp = timestamp;
        }

        public StepEnvelope getEnvelope() {
            return envelope;
        }

        public Fail getFail() {
            return fail;
        }

        public long getTimestamp() {
            return timestamp;
        }
    }
}
