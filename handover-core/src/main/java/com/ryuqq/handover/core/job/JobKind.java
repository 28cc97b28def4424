package com.ryuqq.handover.core.job;

/**
 * Handover가 제출하는 외부 작업의 종류.
 *
 * @author Handover Team
 * @since 1.0.0
 */
public enum JobKind {

    /**
     * Health-check 검증 작업.
     */
    VALIDATION,

    /**
     * 데이터베이스 복사 작업.
     */
    COPY,

    /**
     * 메타데이터 갱신 작업.
     */
    METADATA
}
