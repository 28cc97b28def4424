package com.ryuqq.handover.core.exception;

/**
 * 알림 전송 실패.
 *
 * <p>알림은 best-effort이므로 호출자는 로그만 남기고 파이프라인을 계속 진행합니다.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class NotificationException extends HandoverException {

    public static final String ERROR_CODE = "NOTIFICATION_FAILED";

    public NotificationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause, true);
    }
}
