package com.ryuqq.handover.core.spi;

/**
 * 외부 전달 채널을 통한 알림 전송.
 *
 * @author Handover Team
 * @since 1.0.0
 */
public interface Notifier {

    /**
     * 메시지 전송.
     *
     * @param recipient 수신자
     * @param subject 제목
     * @param body 본문
     * @throws com.ryuqq.handover.core.exception.NotificationException 전송 실패 시
     */
    void notify(String recipient, String subject, String body);
}
