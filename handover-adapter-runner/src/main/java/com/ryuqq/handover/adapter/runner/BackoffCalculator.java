package com.ryuqq.handover.adapter.runner;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 재전달 지연 계산기 (Exponential Backoff + Jitter).
 *
 * <p>예외로 실패한 step을 다시 발행할 때의 지연을 계산합니다.
 * 외부 작업 폴링 간격과는 무관합니다.</p>
 *
 * <p><strong>계산식:</strong></p>
 * <pre>
 * exponential = min(baseDelayMs * 2^(failureCount - 1), maxDelayMs)
 * delay       = min(exponential + exponential * jitterFactor * random[0, 1), maxDelayMs)
 * </pre>
 *
 * <p><strong>기본값:</strong> base 1초, max 5분, jitter 10%</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    public BackoffCalculator() {
        this(1000, 300000, 0.1);
    }

    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random [0, 1) 범위의 jitter 난수 공급자
     * @throws IllegalArgumentException 파라미터가 유효하지 않은 경우
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * 재전달 지연 계산.
     *
     * @param failureCount 누적 실패 횟수 (1부터)
     * @return 지연 시간 (밀리초)
     * @throws IllegalArgumentException failureCount가 1 미만인 경우
     */
    public long calculate(int failureCount) {
        if (failureCount <= 0) {
            throw new IllegalArgumentException(
                "failureCount must be positive (current: " + failureCount + ")"
            );
        }

        // shift 62 이상은 overflow
        int shift = Math.min(failureCount - 1, 62);
        long multiplier = 1L << shift;
        long exponential = multiplier > maxDelayMs / baseDelayMs
            ? maxDelayMs
            : Math.min(baseDelayMs * multiplier, maxDelayMs);

        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());
        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
