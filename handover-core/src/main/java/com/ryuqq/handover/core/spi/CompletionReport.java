package com.ryuqq.handover.core.spi;

import com.ryuqq.handover.core.job.JobState;

/**
 * 상태 URL이 보고하는 작업 상태와 알림 내용.
 *
 * @param state 작업 상태
 * @param subject 알림 제목 (진행 중이면 null 가능)
 * @param body 알림 본문 (진행 중이면 null 가능)
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record CompletionReport(
    JobState state,
    String subject,
    String body
) {

    public CompletionReport {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (!state.isPending() && (subject == null || body == null)) {
            throw new IllegalArgumentException("completed report must carry subject and body");
        }
    }

    public boolean isPending() {
        return state.isPending();
    }
}
