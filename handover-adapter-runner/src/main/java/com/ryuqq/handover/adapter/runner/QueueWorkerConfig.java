package com.ryuqq.handover.adapter.runner;

/**
 * QueueWorkerRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>batchSize: pump 한 번에 dequeue할 최대 Envelope 수 (기본 10)</li>
 *   <li>concurrency: 워커 스레드 수 (기본 5)</li>
 *   <li>maxDeliveryAttempts: 예외로 실패한 step의 최대 전달 횟수 (기본 5)</li>
 *   <li>dlqEnabled: 전달 횟수 소진 시 DLQ 전송 여부 (기본 true)</li>
 * </ul>
 *
 * <p>폴링 재예약(Reschedule)은 maxDeliveryAttempts에 포함되지 않으며 상한이 없습니다.</p>
 *
 * @param batchSize 배치 크기 (양수)
 * @param concurrency 워커 스레드 수 (양수)
 * @param maxDeliveryAttempts 최대 전달 횟수 (양수)
 * @param dlqEnabled DLQ 사용 여부
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record QueueWorkerConfig(
    int batchSize,
    int concurrency,
    int maxDeliveryAttempts,
    boolean dlqEnabled
) {

    public QueueWorkerConfig() {
        this(10, 5, 5, true);
    }

    public QueueWorkerConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (maxDeliveryAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxDeliveryAttempts must be positive (current: " + maxDeliveryAttempts + ")"
            );
        }
    }

    public QueueWorkerConfig withBatchSize(int batchSize) {
        return new QueueWorkerConfig(batchSize, concurrency, maxDeliveryAttempts, dlqEnabled);
    }

    public QueueWorkerConfig withConcurrency(int concurrency) {
        return new QueueWorkerConfig(batchSize, concurrency, maxDeliveryAttempts, dlqEnabled);
    }

    public QueueWorkerConfig withMaxDeliveryAttempts(int maxDeliveryAttempts) {
        return new QueueWorkerConfig(batchSize, concurrency, maxDeliveryAttempts, dlqEnabled);
    }

    public QueueWorkerConfig withDlqEnabled(boolean dlqEnabled) {
        return new QueueWorkerConfig(batchSize, concurrency, maxDeliveryAttempts, dlqEnabled);
    }
}
