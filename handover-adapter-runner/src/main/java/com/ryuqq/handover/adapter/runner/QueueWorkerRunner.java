package com.ryuqq.handover.adapter.runner;

import com.ryuqq.handover.application.runtime.Runtime;
import com.ryuqq.handover.application.scheduling.StepScheduler;
import com.ryuqq.handover.core.contract.StepEnvelope;
import com.ryuqq.handover.core.contract.StepName;
import com.ryuqq.handover.core.exception.HandoverException;
import com.ryuqq.handover.core.model.TaskId;
import com.ryuqq.handover.core.outcome.Advance;
import com.ryuqq.handover.core.outcome.Fail;
import com.ryuqq.handover.core.outcome.Finish;
import com.ryuqq.handover.core.outcome.Reschedule;
import com.ryuqq.handover.core.outcome.StepOutcome;
import com.ryuqq.handover.core.spi.Bus;
import com.ryuqq.handover.core.spi.StepHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Bus 기반 step 실행기.
 *
 * <p>pump()마다 Bus에서 배치를 꺼내 고정 크기 워커 풀에서 step 핸들러를 실행하고
 * 결과(StepOutcome)에 따라 다음 step 예약, 폴링 재예약, 종료를 처리합니다.</p>
 *
 * <p><strong>결과 처리:</strong></p>
 * <ul>
 *   <li>Advance: 다음 step을 새 작업으로 예약 → ACK</li>
 *   <li>Reschedule: 같은 작업을 pollCount + 1로 지연 재발행 → ACK (상한 없음)</li>
 *   <li>Finish: ACK</li>
 * </ul>
 *
 * <p><strong>예외 처리:</strong></p>
 * <ul>
 *   <li>재시도 가능 예외: failureCount + 1로 backoff 지연 재발행, maxDeliveryAttempts 도달 시 DLQ</li>
 *   <li>재시도 불가 예외 ({@link HandoverException#isRetryable()} false): 즉시 DLQ</li>
 *   <li>등록되지 않은 step: 즉시 DLQ (UNKNOWN_STEP)</li>
 * </ul>
 *
 * <p>재발행은 항상 ACK보다 먼저 수행하므로 중간에 프로세스가 죽으면 중복 전달될 수 있으며
 * 유실되지는 않습니다. 핸들러는 멱등해야 합니다.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public final class QueueWorkerRunner implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(QueueWorkerRunner.class);

    static final String UNKNOWN_STEP = "UNKNOWN_STEP";
    static final String UNEXPECTED_ERROR = "UNEXPECTED_ERROR";

    private final Bus bus;
    private final StepScheduler scheduler;
    private final Map<StepName, StepHandler> handlers;
    private final QueueWorkerConfig config;
    private final BackoffCalculator backoffCalculator;
    private final ExecutorService workerExecutor;

    public QueueWorkerRunner(Bus bus, StepScheduler scheduler, Map<StepName, StepHandler> handlers,
                             QueueWorkerConfig config) {
        this(bus, scheduler, handlers, config, new BackoffCalculator());
    }

    public QueueWorkerRunner(Bus bus, StepScheduler scheduler, Map<StepName, StepHandler> handlers,
                             QueueWorkerConfig config, BackoffCalculator backoffCalculator) {
        this(bus, scheduler, handlers, config, backoffCalculator,
            Executors.newFixedThreadPool(requireConfig(config).concurrency()));
    }

    /**
     * @param workerExecutor step 실행 스레드 풀 (shutdown()에서 함께 종료됨)
     */
    public QueueWorkerRunner(Bus bus, StepScheduler scheduler, Map<StepName, StepHandler> handlers,
                             QueueWorkerConfig config, BackoffCalculator backoffCalculator,
                             ExecutorService workerExecutor) {
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (handlers == null) {
            throw new IllegalArgumentException("handlers cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (workerExecutor == null) {
            throw new IllegalArgumentException("workerExecutor cannot be null");
        }

        this.bus = bus;
        this.scheduler = scheduler;
        this.handlers = handlers.isEmpty() ? Map.of() : new EnumMap<>(handlers);
        this.config = requireConfig(config);
        this.backoffCalculator = backoffCalculator;
        this.workerExecutor = workerExecutor;
    }

    @Override
    public void pump() {
        if (workerExecutor.isShutdown()) {
            throw new IllegalStateException("QueueWorkerRunner has been shut down");
        }

        List<StepEnvelope> envelopes = bus.dequeue(config.batchSize());
        for (StepEnvelope envelope : envelopes) {
            workerExecutor.submit(() -> process(envelope));
        }
    }

    /**
     * 워커 풀 종료 (최대 60초 대기).
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
            workerExecutor.shutdownNow();
        }
    }

    void process(StepEnvelope envelope) {
        StepHandler handler = handlers.get(envelope.step());
        if (handler == null) {
            log.error("No handler registered for step {} ({})", envelope.step(), envelope.taskId());
            deadLetter(envelope, Fail.of(UNKNOWN_STEP, "No handler registered for step " + envelope.step()));
            return;
        }

        StepOutcome outcome;
        try {
            outcome = handler.handle(envelope);
            if (outcome == null) {
                throw new IllegalStateException("Handler for " + envelope.step() + " returned no outcome");
            }
        } catch (RuntimeException e) {
            handleFailure(envelope, e);
            return;
        }

        try {
            apply(envelope, outcome);
            bus.ack(envelope);
        } catch (RuntimeException e) {
            log.error("Failed to apply {} for {} ({}), returning it to the queue",
                outcome.getClass().getSimpleName(), envelope.step(), envelope.taskId(), e);
            bus.nack(envelope);
        }
    }

    private void apply(StepEnvelope envelope, StepOutcome outcome) {
        if (outcome instanceof Advance advance) {
            TaskId next = scheduler.enqueue(advance.next(), advance.payload(), 0);
            log.debug("{} ({}) advanced to {} ({})", envelope.step(), envelope.taskId(), advance.next(), next);
        } else if (outcome instanceof Reschedule reschedule) {
            StepEnvelope again = envelope.nextPoll();
            bus.publish(again, reschedule.delayMs());
            log.debug("{} ({}) rescheduled in {}ms, poll {}: {}", envelope.step(), envelope.taskId(),
                reschedule.delayMs(), again.pollCount(), reschedule.reason());
        } else if (outcome instanceof Finish finish) {
            log.debug("{} ({}) finished: {}", envelope.step(), envelope.taskId(), finish.reason());
        }
    }

    private void handleFailure(StepEnvelope envelope, RuntimeException e) {
        boolean retryable = !(e instanceof HandoverException handoverException) || handoverException.isRetryable();
        int failures = envelope.failureCount() + 1;

        if (retryable && failures < config.maxDeliveryAttempts()) {
            long delay = backoffCalculator.calculate(failures);
            bus.publish(envelope.nextFailure(), delay);
            bus.ack(envelope);
            log.warn("{} ({}) failed (attempt {}/{}), redelivering in {}ms: {}", envelope.step(),
                envelope.taskId(), failures, config.maxDeliveryAttempts(), delay, e.getMessage());
            return;
        }

        log.error("{} ({}) failed permanently after {} attempt(s)", envelope.step(), envelope.taskId(), failures, e);
        deadLetter(envelope, toFail(e));
    }

    private void deadLetter(StepEnvelope envelope, Fail fail) {
        if (config.dlqEnabled()) {
            bus.publishToDLQ(envelope, fail);
        } else {
            log.error("DLQ disabled, dropping {} ({}): {}", envelope.step(), envelope.taskId(), fail.message());
            bus.ack(envelope);
        }
    }

    static Fail toFail(RuntimeException e) {
        String errorCode = e instanceof HandoverException handoverException
            ? handoverException.getErrorCode()
            : UNEXPECTED_ERROR;
        String message = e.getMessage() != null && !e.getMessage().isBlank()
            ? e.getMessage()
            : e.getClass().getSimpleName();
        return Fail.of(errorCode, message, e.getClass().getName());
    }

    private static QueueWorkerConfig requireConfig(QueueWorkerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }
}
