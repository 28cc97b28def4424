package com.ryuqq.handover.application.coordinator;

import com.ryuqq.handover.core.model.HandoverRequest;

/**
 * Handover 완료 시 호출되는 확장 지점.
 *
 * <p>메타데이터 갱신이 제출된 뒤, handover가 DONE으로 전이되기 직전에 호출됩니다.
 * 최종 완료 알림이 필요한 배포에서 구현합니다.</p>
 *
 * <p>예외를 던지면 step이 재전달되어 다시 호출되므로 구현체는 멱등해야 합니다.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface HandoverCompletionHandler {

    /**
     * @param request 모든 작업 ID가 기록된 요청 스냅샷
     */
    void onHandoverComplete(HandoverRequest request);
}
