package com.ryuqq.handover.core.contract;

/**
 * 지연 실행 step에 실려 전달되는 불변 스냅샷.
 *
 * <p>Step 경계를 넘을 때 payload는 값으로 복사되어 전달되며, 공유 가변 객체가 아닙니다.
 * 각 step은 자신의 스냅샷을 받고 다음 스냅샷을 만들어 반환합니다.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public interface StepPayload {
}
