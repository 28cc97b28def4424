package com.ryuqq.handover.core.outcome;

/**
 * Step 실행 결과.
 *
 * <p>StepOutcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Advance}: 다음 step을 payload와 함께 등록</li>
 *   <li>{@link Reschedule}: 같은 step을 지연 후 다시 실행 (외부 작업 대기)</li>
 *   <li>{@link Finish}: 더 이상 실행할 step 없음</li>
 * </ul>
 *
 * <p>인프라 오류(전송 실패, 잘못된 응답)는 결과가 아니라 예외로 전파되며,
 * 큐의 재전달/DLQ 정책이 적용됩니다.</p>
 *
 * <p>Sealed interface로 정의되어 모든 케이스가 컴파일 타임에 알려집니다.</p>
 *
 * <p><strong>처리 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Advance advance) {
 *     scheduler.enqueue(advance.next(), advance.payload(), 0);
 * } else if (outcome instanceof Reschedule reschedule) {
 *     bus.publish(envelope.nextPoll(), reschedule.delayMs());
 * } else if (outcome instanceof Finish finish) {
 *     log.info("finished: {}", finish.reason());
 * }
 * </pre>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public sealed interface StepOutcome permits Advance, Reschedule, Finish {

    default boolean isAdvance() {
        return this instanceof Advance;
    }

    default boolean isReschedule() {
        return this instanceof Reschedule;
    }

    default boolean isFinish() {
        return this instanceof Finish;
    }
}
