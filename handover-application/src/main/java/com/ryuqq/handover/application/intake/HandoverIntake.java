package com.ryuqq.handover.application.intake;

import com.ryuqq.handover.core.model.HandoverSubmission;
import com.ryuqq.handover.core.model.HandoverToken;

/**
 * Handover 접수 진입점.
 *
 * <p>요청 검증과 첫 작업 제출은 호출 스레드에서 동기적으로 수행되고,
 * 이후 단계는 지연 실행 큐에서 진행됩니다.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public interface HandoverIntake {

    /**
     * Handover 요청 접수.
     *
     * @param submission 접수 요청
     * @return 발급된 handover 토큰
     * @throws com.ryuqq.handover.core.exception.IntakeValidationException 필수 값 누락, 잘못된 URI, source 없음
     * @throws com.ryuqq.handover.core.exception.DatabaseCheckException source 확인 불가
     * @throws com.ryuqq.handover.core.exception.JobSubmissionException 첫 작업 제출 실패
     */
    HandoverToken submit(HandoverSubmission submission);
}
