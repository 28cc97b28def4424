package com.ryuqq.handover.core.spi;

import com.ryuqq.handover.core.contract.StepEnvelope;
import com.ryuqq.handover.core.outcome.StepOutcome;

/**
 * 하나의 step 이름을 처리하는 실행자.
 *
 * <p>Step은 스케줄링 기반과 독립적으로 결과({@link StepOutcome})만 반환하며,
 * 등록/재예약은 러너가 수행합니다.</p>
 *
 * <p>같은 Envelope이 두 번 이상 전달될 수 있으므로 구현체는 멱등해야 합니다.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StepHandler {

    /**
     * Step 실행.
     *
     * @param envelope 실행할 Envelope
     * @return 실행 결과
     * @throws com.ryuqq.handover.core.exception.HandoverException 인프라 오류 (큐의 재전달 정책 적용)
     */
    StepOutcome handle(StepEnvelope envelope);
}
