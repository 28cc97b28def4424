package com.ryuqq.handover.core.statemachine;

/**
 * Handover 요청의 생명주기 단계.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * INTAKE
 *    │
 *    ├─► VALIDATION_SKIPPED ─────────────┐
 *    │                                   │
 *    └─► AWAITING_VALIDATION             │
 *           │                            │
 *           ├─► VALIDATION_ERROR (종료)   │
 *           ├─► VALIDATION_REJECTED (종료)│
 *           └─► AWAITING_COPY ◄──────────┘
 *                  │
 *                  ├─► COPY_FAILED (종료)
 *                  └─► AWAITING_METADATA
 *                         │
 *                         └─► DONE (종료)
 *
 * 금지된 전이:
 * - 종료 상태 → * ❌
 * - 이전 단계로의 역방향 전이 ❌
 * </pre>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public enum HandoverStage {

    /**
     * 접수됨 (작업 제출 전).
     */
    INTAKE,

    /**
     * 검증 그룹이 없어 검증을 건너뜀.
     */
    VALIDATION_SKIPPED,

    /**
     * 검증 작업 완료 대기 중.
     */
    AWAITING_VALIDATION,

    /**
     * 복사 작업 완료 대기 중.
     */
    AWAITING_COPY,

    /**
     * 메타데이터 갱신 대기 중.
     */
    AWAITING_METADATA,

    /**
     * 완료 (성공).
     */
    DONE,

    /**
     * 검증이 실행되었으나 문제를 발견함.
     */
    VALIDATION_REJECTED,

    /**
     * 검증 작업 자체가 실행되지 못함.
     */
    VALIDATION_ERROR,

    /**
     * 복사 실패.
     */
    COPY_FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return DONE, VALIDATION_REJECTED, VALIDATION_ERROR, COPY_FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == DONE || this == VALIDATION_REJECTED || this == VALIDATION_ERROR || this == COPY_FAILED;
    }

    /**
     * 실패로 끝난 종료 상태인지 확인.
     */
    public boolean isFailure() {
        return this == VALIDATION_REJECTED || this == VALIDATION_ERROR || this == COPY_FAILED;
    }
}
