package com.ryuqq.handover.application.scheduling;

import com.ryuqq.handover.core.contract.StepEnvelope;
import com.ryuqq.handover.core.contract.StepName;
import com.ryuqq.handover.core.contract.StepPayload;
import com.ryuqq.handover.core.model.TaskId;
import com.ryuqq.handover.core.spi.Bus;

import java.time.Clock;

/**
 * Step 예약기.
 *
 * <p>새 작업을 만들어 Bus에 지연 발행합니다. 폴링 재예약은 Runtime이 기존 Envelope를
 * 그대로 재발행하므로 이 클래스를 거치지 않습니다.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class StepScheduler {

    private final Bus bus;
    private final Clock clock;

    public StepScheduler(Bus bus) {
        this(bus, Clock.systemUTC());
    }

    public StepScheduler(Bus bus, Clock clock) {
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.bus = bus;
        this.clock = clock;
    }

    /**
     * step 예약.
     *
     * @param step 실행할 step
     * @param payload step 입력 스냅샷
     * @param delayMs 지연 시간 (밀리초, 0 이상)
     * @return 새 작업 식별자
     * @throws IllegalArgumentException 인자가 null이거나 delayMs가 음수인 경우
     */
    public TaskId enqueue(StepName step, StepPayload payload, long delayMs) {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be non-negative (current: " + delayMs + ")");
        }
        StepEnvelope envelope = StepEnvelope.first(TaskId.random(), step, payload, clock.millis());
        bus.publish(envelope, delayMs);
        return envelope.taskId();
    }
}
