package com.ryuqq.handover.core.contract;

import com.ryuqq.handover.core.model.CompletionWatch;
import com.ryuqq.handover.core.model.HandoverRequest;
import com.ryuqq.handover.core.model.TaskId;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StepEnvelopeTest {

    private final CompletionWatch payload = new CompletionWatch("http://status/1", "someone@example.org");

    @Test
    void nextPoll_은_작업을_유지하고_pollCount를_늘린다() {
        // given
        StepEnvelope envelope = StepEnvelope.first(TaskId.of("t-1"), StepName.WATCH_COMPLETION, payload, 100)
            .nextFailure();

        // when
        StepEnvelope next = envelope.nextPoll();

        // then
        assertThat(next.taskId()).isEqualTo(envelope.taskId());
        assertThat(next.pollCount()).isEqualTo(1);
        assertThat(next.failureCount()).isZero();
        assertThat(next.enqueuedAt()).isEqualTo(100);
        assertThat(next).isNotEqualTo(envelope);
    }

    @Test
    void nextFailure_는_failureCount를_늘린다() {
        StepEnvelope envelope = StepEnvelope.first(TaskId.of("t-1"), StepName.WATCH_COMPLETION, payload, 100);

        assertThat(envelope.nextFailure().nextFailure().failureCount()).isEqualTo(2);
        assertThat(envelope.nextFailure().pollCount()).isZero();
    }

    @Test
    void payloadAs_는_다른_타입을_거부한다() {
        StepEnvelope envelope = StepEnvelope.first(TaskId.of("t-1"), StepName.WATCH_COMPLETION, payload, 100);

        assertThat(envelope.payloadAs(CompletionWatch.class)).isEqualTo(payload);
        assertThatThrownBy(() -> envelope.payloadAs(HandoverRequest.class))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("HandoverRequest");
    }

    @Test
    void 음수_카운트는_거부된다() {
        assertThatThrownBy(() -> new StepEnvelope(TaskId.of("t-1"), StepName.CHECK_COPY, payload, -1, 0, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
