package com.ryuqq.handover.core.contract;

/**
 * 지연 실행 큐가 실행하는 step 이름.
 *
 * @author Handover Team
 * @since 1.0.0
 */
public enum StepName {

    /**
     * 검증 작업 상태 확인 (payload: HandoverRequest).
     */
    CHECK_VALIDATION,

    /**
     * 복사 작업 상태 확인 (payload: HandoverRequest).
     */
    CHECK_COPY,

    /**
     * 메타데이터 갱신 처리 (payload: HandoverRequest).
     */
    CHECK_METADATA,

    /**
     * 상태 URL 완료 감시 후 알림 (payload: CompletionWatch).
     */
    WATCH_COMPLETION,

    /**
     * 메일 한 통 전송 (payload: EmailMessage).
     */
    SEND_EMAIL
}
