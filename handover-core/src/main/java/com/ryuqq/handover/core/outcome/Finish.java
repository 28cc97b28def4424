package com.ryuqq.handover.core.outcome;

/**
 * 더 이상 실행할 step이 없음.
 *
 * <p>Handover가 종료 단계에 도달했거나, 중복 전달된 step을 무시한 경우입니다.</p>
 *
 * @param reason 종료 사유
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record Finish(
    String reason
) implements StepOutcome {

    public Finish {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }

    public static Finish because(String reason) {
        return new Finish(reason);
    }
}
