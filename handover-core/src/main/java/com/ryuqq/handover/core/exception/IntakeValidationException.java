package com.ryuqq.handover.core.exception;

/**
 * 접수 요청이 유효하지 않음 (필수 필드 누락, 잘못된 URI 등).
 *
 * <p>호출자에게 동기적으로 전달되며, 어떤 작업도 제출되지 않습니다.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class IntakeValidationException extends HandoverException {

    public static final String ERROR_CODE = "INTAKE_INVALID";

    public IntakeValidationException(String message) {
        super(ERROR_CODE, message, false);
    }

    public IntakeValidationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause, false);
    }

    protected IntakeValidationException(String errorCode, String message) {
        super(errorCode, message, false);
    }
}
