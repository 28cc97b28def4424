package com.ryuqq.handover.core.exception;

/**
 * 데이터베이스 존재 여부를 확인할 수 없음 (서버 연결 실패 등).
 *
 * <p>"존재하지 않음"과 구분됩니다.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class DatabaseCheckException extends HandoverException {

    public static final String ERROR_CODE = "DATABASE_CHECK_FAILED";

    public DatabaseCheckException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause, true);
    }
}
