package com.ryuqq.handover.core.exception;

/**
 * Handover 처리 중 발생하는 모든 예외의 상위 타입.
 *
 * <p>각 예외는 DLQ 기록과 로깅에 사용되는 오류 코드를 가지며,
 * 큐가 재전달해도 되는지({@link #isRetryable()}) 알려줍니다.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class HandoverException extends RuntimeException {

    private final String errorCode;
    private final boolean retryable;

    public HandoverException(String errorCode, String message, boolean retryable) {
        this(errorCode, message, null, retryable);
    }

    public HandoverException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * 같은 입력으로 다시 실행하면 성공할 가능성이 있는지 여부.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
