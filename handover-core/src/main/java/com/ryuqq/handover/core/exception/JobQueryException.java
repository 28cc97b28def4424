package com.ryuqq.handover.core.exception;

/**
 * 작업 상태를 조회할 수 없거나 응답을 해석할 수 없음.
 *
 * <p>절대로 "진행 중"으로 취급되지 않습니다. 응답 형식 오류는
 * {@link #MALFORMED_RESPONSE} 코드로 전송 실패({@link #ERROR_CODE})와 구분됩니다.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class JobQueryException extends HandoverException {

    public static final String ERROR_CODE = "JOB_QUERY_FAILED";
    public static final String MALFORMED_RESPONSE = "MALFORMED_RESPONSE";

    public JobQueryException(String message) {
        super(ERROR_CODE, message, true);
    }

    public JobQueryException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause, true);
    }

    public JobQueryException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(errorCode, message, cause, retryable);
    }

    /**
     * 응답 형식 오류 생성.
     *
     * @param message 오류 메시지
     * @param cause 원인 (null 가능)
     * @return MALFORMED_RESPONSE 코드의 예외 (재시도 가능)
     */
    public static JobQueryException malformed(String message, Throwable cause) {
        return new JobQueryException(MALFORMED_RESPONSE, message, cause, true);
    }

    public boolean isMalformedResponse() {
        return MALFORMED_RESPONSE.equals(getErrorCode());
    }
}
