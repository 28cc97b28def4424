package com.ryuqq.handover.core.contract;

import com.ryuqq.handover.core.model.TaskId;

/**
 * Step 실행을 위한 봉투 (Envelope).
 *
 * <p>지연 실행 큐가 저장하고 전달하는 단위입니다. payload 스냅샷과 전달 메타데이터를 함께 담습니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>taskId:</strong> 작업 식별자 (재예약 시 유지)</li>
 *   <li><strong>step:</strong> 실행할 step 이름</li>
 *   <li><strong>payload:</strong> step 입력 스냅샷</li>
 *   <li><strong>pollCount:</strong> 폴링 재예약 횟수 (상한 없음)</li>
 *   <li><strong>failureCount:</strong> 인프라 오류로 인한 재전달 횟수</li>
 *   <li><strong>enqueuedAt:</strong> 등록 시각 (epoch milliseconds)</li>
 * </ul>
 *
 * @param taskId 작업 식별자
 * @param step step 이름
 * @param payload step 입력
 * @param pollCount 폴링 재예약 횟수 (0 이상)
 * @param failureCount 재전달 횟수 (0 이상)
 * @param enqueuedAt 등록 시각 (epoch millis)
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record StepEnvelope(
    TaskId taskId,
    StepName step,
    StepPayload payload,
    int pollCount,
    int failureCount,
    long enqueuedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 카운트/시각이 음수인 경우
     */
    public StepEnvelope {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (pollCount < 0) {
            throw new IllegalArgumentException("pollCount must be non-negative (current: " + pollCount + ")");
        }
        if (failureCount < 0) {
            throw new IllegalArgumentException("failureCount must be non-negative (current: " + failureCount + ")");
        }
        if (enqueuedAt < 0) {
            throw new IllegalArgumentException("enqueuedAt must be non-negative (current: " + enqueuedAt + ")");
        }
    }

    /**
     * 새 작업의 첫 Envelope 생성.
     *
     * @param taskId 작업 식별자
     * @param step step 이름
     * @param payload step 입력
     * @param enqueuedAt 등록 시각 (epoch millis)
     * @return pollCount, failureCount가 0인 Envelope
     */
    public static StepEnvelope first(TaskId taskId, StepName step, StepPayload payload, long enqueuedAt) {
        return new StepEnvelope(taskId, step, payload, 0, 0, enqueuedAt);
    }

    /**
     * 폴링 재예약용 Envelope (pollCount + 1, failureCount 초기화).
     */
    public StepEnvelope nextPoll() {
        return new StepEnvelope(taskId, step, payload, pollCount + 1, 0, enqueuedAt);
    }

    /**
     * 인프라 오류 재전달용 Envelope (failureCount + 1).
     */
    public StepEnvelope nextFailure() {
        return new StepEnvelope(taskId, step, payload, pollCount, failureCount + 1, enqueuedAt);
    }

    /**
     * payload를 기대 타입으로 변환.
     *
     * @param type 기대 타입
     * @param <T> payload 타입
     * @return 변환된 payload
     * @throws IllegalStateException payload 타입이 다른 경우
     */
    public <T extends StepPayload> T payloadAs(Class<T> type) {
        if (!type.isInstance(payload)) {
            throw new IllegalStateException(
                String.format("Step %s expects %s payload but got %s", step, type.getSimpleName(),
                    payload.getClass().getSimpleName())
            );
        }
        return type.cast(payload);
    }
}
