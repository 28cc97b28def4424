package com.ryuqq.handover.core.model;

import com.ryuqq.handover.core.contract.StepPayload;

/**
 * 지연 전송 메일 step의 payload.
 *
 * @param recipient 수신자 (쉼표로 여러 명 지정 가능)
 * @param subject 제목
 * @param body 본문 (null이면 빈 본문)
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record EmailMessage(
    String recipient,
    String subject,
    String body
) implements StepPayload {

    public EmailMessage {
        if (recipient == null || recipient.isBlank()) {
            throw new IllegalArgumentException("recipient cannot be null or blank");
        }
        if (subject == null) {
            throw new IllegalArgumentException("subject cannot be null");
        }
    }
}
