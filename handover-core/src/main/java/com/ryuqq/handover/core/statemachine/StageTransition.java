package com.ryuqq.handover.core.statemachine;

import static com.ryuqq.handover.core.statemachine.HandoverStage.AWAITING_COPY;
import static com.ryuqq.handover.core.statemachine.HandoverStage.AWAITING_METADATA;
import static com.ryuqq.handover.core.statemachine.HandoverStage.AWAITING_VALIDATION;
import static com.ryuqq.handover.core.statemachine.HandoverStage.COPY_FAILED;
import static com.ryuqq.handover.core.statemachine.HandoverStage.DONE;
import static com.ryuqq.handover.core.statemachine.HandoverStage.VALIDATION_ERROR;
import static com.ryuqq.handover.core.statemachine.HandoverStage.VALIDATION_REJECTED;
import static com.ryuqq.handover.core.statemachine.HandoverStage.VALIDATION_SKIPPED;

/**
 * Handover 단계 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>INTAKE → VALIDATION_SKIPPED, AWAITING_VALIDATION</li>
 *   <li>VALIDATION_SKIPPED → AWAITING_COPY</li>
 *   <li>AWAITING_VALIDATION → AWAITING_COPY, VALIDATION_REJECTED, VALIDATION_ERROR</li>
 *   <li>AWAITING_COPY → AWAITING_METADATA, COPY_FAILED</li>
 *   <li>AWAITING_METADATA → DONE</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 단계는 단조 증가하며 종료 상태에서는 어떤 상태로도 전이할 수 없습니다.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public final class StageTransition {

    // Utility class - prevent instantiation
    private StageTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이가 허용되는지 확인.
     *
     * @param from 현재 단계
     * @param to 다음 단계
     * @return 허용되면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(HandoverStage from, HandoverStage to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Stages cannot be null (from: " + from + ", to: " + to + ")");
        }
        return switch (from) {
            case INTAKE -> to == VALIDATION_SKIPPED || to == AWAITING_VALIDATION;
            case VALIDATION_SKIPPED -> to == AWAITING_COPY;
            case AWAITING_VALIDATION -> to == AWAITING_COPY || to == VALIDATION_REJECTED || to == VALIDATION_ERROR;
            case AWAITING_COPY -> to == AWAITING_METADATA || to == COPY_FAILED;
            case AWAITING_METADATA -> to == DONE;
            case DONE, VALIDATION_REJECTED, VALIDATION_ERROR, COPY_FAILED -> false;
        };
    }

    /**
     * 전이 검증.
     *
     * @param from 현재 단계
     * @param to 다음 단계
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     */
    public static void validate(HandoverStage from, HandoverStage to) {
        if (from != null && from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal stage: %s → %s", from, to)
            );
        }
        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid stage transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 검증 후 전이.
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @return 전이된 단계 (next)
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     */
    public static HandoverStage transition(HandoverStage current, HandoverStage next) {
        validate(current, next);
        return next;
    }
}
