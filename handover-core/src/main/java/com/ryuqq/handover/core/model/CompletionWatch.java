package com.ryuqq.handover.core.model;

import com.ryuqq.handover.core.contract.StepPayload;

/**
 * 완료 감시 step의 payload.
 *
 * <p>statusUrl이 완료 상태를 보고하면 보고서에 담긴 제목과 본문으로 recipient에게 알림을 보냅니다.</p>
 *
 * @param statusUrl 상태 조회 URL (status, subject, body 필드를 가진 JSON 반환)
 * @param recipient 알림 수신자
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record CompletionWatch(
    String statusUrl,
    String recipient
) implements StepPayload {

    public CompletionWatch {
        if (statusUrl == null || statusUrl.isBlank()) {
            throw new IllegalArgumentException("statusUrl cannot be null or blank");
        }
        if (recipient == null || recipient.isBlank()) {
            throw new IllegalArgumentException("recipient cannot be null or blank");
        }
    }
}
