package com.ryuqq.handover.core.outcome;

/**
 * 같은 step을 지연 후 다시 실행.
 *
 * <p>외부 작업이 아직 진행 중일 때 사용합니다. 워커 스레드에서 대기하지 않고
 * 지연 등록으로 대체하며, 재예약 횟수에 상한이 없습니다.</p>
 *
 * @param reason 재예약 사유
 * @param delayMs 재실행까지 대기 시간 (밀리초, 0 이상)
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record Reschedule(
    String reason,
    long delayMs
) implements StepOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Reschedule {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be non-negative (current: " + delayMs + ")");
        }
    }

    public static Reschedule after(long delayMs, String reason) {
        return new Reschedule(reason, delayMs);
    }
}
