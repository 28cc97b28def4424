package com.ryuqq.handover.core.exception;

/**
 * 외부 작업 서비스가 제출을 거부했거나 연결할 수 없음.
 *
 * <p>비즈니스 실패로 해석되지 않고 큐의 재전달/DLQ 정책으로 전파됩니다.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class JobSubmissionException extends HandoverException {

    public static final String ERROR_CODE = "JOB_SUBMISSION_FAILED";

    public JobSubmissionException(String message) {
        super(ERROR_CODE, message, true);
    }

    public JobSubmissionException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause, true);
    }
}
