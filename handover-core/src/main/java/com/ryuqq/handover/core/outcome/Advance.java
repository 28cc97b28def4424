package com.ryuqq.handover.core.outcome;

import com.ryuqq.handover.core.contract.StepName;
import com.ryuqq.handover.core.contract.StepPayload;

/**
 * 다음 step으로 진행.
 *
 * @param next 다음 step 이름
 * @param payload 다음 step에 전달할 스냅샷
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record Advance(
    StepName next,
    StepPayload payload
) implements StepOutcome {

    public Advance {
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
    }

    public static Advance to(StepName next, StepPayload payload) {
        return new Advance(next, payload);
    }
}
