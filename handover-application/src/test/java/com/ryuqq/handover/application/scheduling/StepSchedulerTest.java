package com.ryuqq.handover.application.scheduling;

import com.ryuqq.handover.core.contract.StepEnvelope;
import com.ryuqq.handover.core.contract.StepName;
import com.ryuqq.handover.core.model.CompletionWatch;
import com.ryuqq.handover.core.model.TaskId;
import com.ryuqq.handover.core.spi.Bus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class StepSchedulerTest {

    @Mock
    private Bus bus;

    @Test
    void enqueue_는_새_작업의_첫_Envelope을_지연_발행한다() {
        // given
        Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);
        StepScheduler scheduler = new StepScheduler(bus, clock);
        CompletionWatch payload = new CompletionWatch("http://status/1", "someone@example.org");

        // when
        TaskId taskId = scheduler.enqueue(StepName.WATCH_COMPLETION, payload, 1500);

        // then
        ArgumentCaptor<StepEnvelope> captor = ArgumentCaptor.forClass(StepEnvelope.class);
        verify(bus).publish(captor.capture(), eq(1500L));
        StepEnvelope envelope = captor.getValue();
        assertThat(envelope.taskId()).isEqualTo(taskId);
        assertThat(envelope.step()).isEqualTo(StepName.WATCH_COMPLETION);
        assertThat(envelope.payload()).isEqualTo(payload);
        assertThat(envelope.pollCount()).isZero();
        assertThat(envelope.failureCount()).isZero();
        assertThat(envelope.enqueuedAt()).isEqualTo(1_700_000_000_000L);
    }

    @Test
    void 음수_지연은_거부된다() {
        // given
        StepScheduler scheduler = new StepScheduler(bus);

        // when & then
        assertThatThrownBy(() -> scheduler.enqueue(StepName.CHECK_COPY,
            new CompletionWatch("http://status/1", "someone@example.org"), -1))
            .isInstanceOf(IllegalArgumentException.class);
        verify(bus, never()).publish(org.mockito.ArgumentMatchers.any(), anyLong());
    }

    @Test
    void 매_호출마다_다른_작업_ID를_발급한다() {
        // given
        StepScheduler scheduler = new StepScheduler(bus);
        CompletionWatch payload = new CompletionWatch("http://status/1", "someone@example.org");

        // when
        TaskId first = scheduler.enqueue(StepName.WATCH_COMPLETION, payload, 0);
        TaskId second = scheduler.enqueue(StepName.WATCH_COMPLETION, payload, 0);

        // then
        assertThat(first).isNotEqualTo(second);
    }
}
