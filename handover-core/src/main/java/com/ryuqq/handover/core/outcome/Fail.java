package com.ryuqq.handover.core.outcome;

/**
 * DLQ로 보내지는 영구 실패 정보.
 *
 * <p>재전달 한도를 소진했거나 재시도해도 성공할 수 없는 step을 DLQ에 기록할 때 사용합니다.</p>
 *
 * @param errorCode 오류 코드 (예: JOB_QUERY_FAILED, UNKNOWN_STEP)
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record Fail(
    String errorCode,
    String message,
    String cause
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode 또는 message가 null이거나 빈 문자열인 경우
     */
    public Fail {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    public static Fail of(String errorCode, String message, String cause) {
        return new Fail(errorCode, message, cause);
    }

    public static Fail of(String errorCode, String message) {
        return new Fail(errorCode, message, null);
    }
}
