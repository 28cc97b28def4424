package com.ryuqq.handover.adapter.runner;

import com.ryuqq.handover.application.scheduling.StepScheduler;
import com.ryuqq.handover.core.contract.StepEnvelope;
import com.ryuqq.handover.core.contract.StepName;
import com.ryuqq.handover.core.exception.JobQueryException;
import com.ryuqq.handover.core.exception.JobSubmissionException;
import com.ryuqq.handover.core.model.CompletionWatch;
import com.ryuqq.handover.core.model.TaskId;
import com.ryuqq.handover.core.outcome.Advance;
import com.ryuqq.handover.core.outcome.Fail;
import com.ryuqq.handover.core.outcome.Finish;
import com.ryuqq.handover.core.outcome.Reschedule;
import com.ryuqq.handover.core.spi.Bus;
import com.ryuqq.handover.core.spi.StepHandler;
import com.ryuqq.handover.testkit.fixture.HandoverFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * QueueWorkerRunner 유닛 테스트.
 *
 * <ul>
 *   <li>Advance / Reschedule / Finish 처리 후 ACK</li>
 *   <li>예외: backoff 재전달, 횟수 소진 또는 재시도 불가 시 DLQ</li>
 *   <li>등록되지 않은 step</li>
 * </ul>
 */
@ExtendWith(MockitoExtension.class)
class QueueWorkerRunnerTest {

    @Mock
    private Bus bus;

    @Mock
    private StepScheduler scheduler;

    private Map<StepName, StepHandler> handlers;
    private QueueWorkerConfig config;
    private StepEnvelope envelope;

    @BeforeEach
    void setUp() {
        handlers = new EnumMap<>(StepName.class);
        config = new QueueWorkerConfig().withMaxDeliveryAttempts(3);
        envelope = HandoverFixtures.watchEnvelope("http://status/1");
    }

    private QueueWorkerRunner runner() {
        return new QueueWorkerRunner(bus, scheduler, handlers, config,
            new BackoffCalculator(1000, 300_000, 0.1, () -> 0.0), new DirectExecutorService());
    }

    private void pumpOnce(StepEnvelope delivered) {
        when(bus.dequeue(anyInt())).thenReturn(List.of(delivered));
        runner().pump();
    }

    // ============================================================
    // 1. 결과 처리
    // ============================================================

    @Test
    void Advance_는_다음_step을_예약한_뒤_ACK한다() {
        // given
        CompletionWatch next = new CompletionWatch("http://status/next", "r@example.org");
        handlers.put(StepName.WATCH_COMPLETION, e -> Advance.to(StepName.CHECK_COPY, next));
        when(scheduler.enqueue(StepName.CHECK_COPY, next, 0)).thenReturn(TaskId.of("next-task"));

        // when
        pumpOnce(envelope);

        // then
        InOrder inOrder = inOrder(scheduler, bus);
        inOrder.verify(scheduler).enqueue(StepName.CHECK_COPY, next, 0);
        inOrder.verify(bus).ack(envelope);
        verify(bus, never()).publishToDLQ(any(), any());
    }

    @Test
    void Reschedule_은_같은_작업을_pollCount를_늘려_지연_발행한다() {
        // given
        handlers.put(StepName.WATCH_COMPLETION, e -> Reschedule.after(60_000, "running"));

        // when
        pumpOnce(envelope);

        // then
        InOrder inOrder = inOrder(bus);
        inOrder.verify(bus).publish(envelope.nextPoll(), 60_000);
        inOrder.verify(bus).ack(envelope);
    }

    @Test
    void Reschedule_은_횟수_제한이_없다() {
        // given
        handlers.put(StepName.WATCH_COMPLETION, e -> Reschedule.after(0, "running"));
        StepEnvelope polledManyTimes = envelope;
        for (int i = 0; i < 500; i++) {
            polledManyTimes = polledManyTimes.nextPoll();
        }

        // when
        pumpOnce(polledManyTimes);

        // then
        verify(bus).publish(polledManyTimes.nextPoll(), 0);
        verify(bus, never()).publishToDLQ(any(), any());
    }

    @Test
    void Finish_는_ACK만_한다() {
        // given
        handlers.put(StepName.WATCH_COMPLETION, e -> Finish.because("done"));

        // when
        pumpOnce(envelope);

        // then
        verify(bus).ack(envelope);
        verify(bus, never()).publish(any(), anyLong());
        verify(scheduler, never()).enqueue(any(), any(), anyLong());
    }

    // ============================================================
    // 2. 예외 처리
    // ============================================================

    @Test
    void 재시도_가능한_예외는_backoff_후_재전달된다() {
        // given
        handlers.put(StepName.WATCH_COMPLETION, e -> {
            throw new JobQueryException("connection refused");
        });

        // when
        pumpOnce(envelope);

        // then
        InOrder inOrder = inOrder(bus);
        inOrder.verify(bus).publish(envelope.nextFailure(), 1000);
        inOrder.verify(bus).ack(envelope);
        verify(bus, never()).publishToDLQ(any(), any());
    }

    @Test
    void 전달_횟수를_소진하면_DLQ로_보낸다() {
        // given
        handlers.put(StepName.WATCH_COMPLETION, e -> {
            throw new JobQueryException("connection refused");
        });
        StepEnvelope twiceFailed = envelope.nextFailure().nextFailure();

        // when
        pumpOnce(twiceFailed);

        // then
        ArgumentCaptor<Fail> fail = ArgumentCaptor.forClass(Fail.class);
        verify(bus).publishToDLQ(eq(twiceFailed), fail.capture());
        assertThat(fail.getValue().errorCode()).isEqualTo(JobQueryException.ERROR_CODE);
        assertThat(fail.getValue().message()).isEqualTo("connection refused");
        assertThat(fail.getValue().cause()).isEqualTo(JobQueryException.class.getName());
        verify(bus, never()).publish(any(), anyLong());
    }

    @Test
    void 재시도_불가_예외는_즉시_DLQ로_보낸다() {
        // given
        handlers.put(StepName.WATCH_COMPLETION, e -> {
            throw new JobQueryException(JobQueryException.MALFORMED_RESPONSE, "not json", null, false);
        });

        // when
        pumpOnce(envelope);

        // then
        ArgumentCaptor<Fail> fail = ArgumentCaptor.forClass(Fail.class);
        verify(bus).publishToDLQ(eq(envelope), fail.capture());
        assertThat(fail.getValue().errorCode()).isEqualTo(JobQueryException.MALFORMED_RESPONSE);
        verify(bus, never()).publish(any(), anyLong());
    }

    @Test
    void 예상치_못한_예외도_재전달한_뒤_UNEXPECTED_ERROR로_DLQ에_보낸다() {
        // given
        handlers.put(StepName.WATCH_COMPLETION, e -> {
            throw new IllegalStateException("store unavailable");
        });

        // when
        pumpOnce(envelope.nextFailure().nextFailure());

        // then
        ArgumentCaptor<Fail> fail = ArgumentCaptor.forClass(Fail.class);
        verify(bus).publishToDLQ(any(), fail.capture());
        assertThat(fail.getValue().errorCode()).isEqualTo(QueueWorkerRunner.UNEXPECTED_ERROR);
    }

    @Test
    void DLQ가_비활성화되면_ACK하고_버린다() {
        // given
        config = config.withDlqEnabled(false);
        handlers.put(StepName.WATCH_COMPLETION, e -> {
            throw new JobSubmissionException("rejected");
        });

        // when
        pumpOnce(envelope.nextFailure().nextFailure());

        // then
        verify(bus, never()).publishToDLQ(any(), any());
        verify(bus).ack(any());
    }

    @Test
    void 핸들러가_결과를_반환하지_않으면_실패로_처리한다() {
        // given
        handlers.put(StepName.WATCH_COMPLETION, e -> null);

        // when
        pumpOnce(envelope);

        // then
        verify(bus).publish(envelope.nextFailure(), 1000);
    }

    @Test
    void 결과_적용에_실패하면_NACK한다() {
        // given
        CompletionWatch next = new CompletionWatch("http://status/next", "r@example.org");
        handlers.put(StepName.WATCH_COMPLETION, e -> Advance.to(StepName.CHECK_COPY, next));
        when(scheduler.enqueue(StepName.CHECK_COPY, next, 0)).thenThrow(new IllegalStateException("bus down"));

        // when
        pumpOnce(envelope);

        // then
        verify(bus).nack(envelope);
        verify(bus, never()).ack(any());
    }

    // ============================================================
    // 3. 등록되지 않은 step, 종료
    // ============================================================

    @Test
    void 등록되지_않은_step은_DLQ로_보낸다() {
        // when
        pumpOnce(envelope);

        // then
        ArgumentCaptor<Fail> fail = ArgumentCaptor.forClass(Fail.class);
        verify(bus).publishToDLQ(eq(envelope), fail.capture());
        assertThat(fail.getValue().errorCode()).isEqualTo(QueueWorkerRunner.UNKNOWN_STEP);
    }

    @Test
    void 빈_배치는_아무것도_하지_않는다() {
        // given
        when(bus.dequeue(anyInt())).thenReturn(List.of());

        // when
        runner().pump();

        // then
        verify(bus, never()).ack(any());
    }

    @Test
    void shutdown_후_pump는_실패한다() throws InterruptedException {
        // given
        QueueWorkerRunner runner = runner();
        runner.shutdown();

        // when & then
        assertThatThrownBy(runner::pump)
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void pump_는_설정된_배치_크기로_dequeue한다() {
        // given
        config = config.withBatchSize(7);
        when(bus.dequeue(7)).thenReturn(List.of());

        // when
        runner().pump();

        // then
        verify(bus).dequeue(7);
    }
}
