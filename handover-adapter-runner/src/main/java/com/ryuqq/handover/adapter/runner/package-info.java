/**
 * Runtime 구현체.
 *
 * <p>{@link com.ryuqq.handover.adapter.runner.QueueWorkerRunner}는 Bus에서 step을 꺼내
 * 등록된 핸들러로 실행하고, 예외는 {@link com.ryuqq.handover.adapter.runner.BackoffCalculator}의
 * 지연으로 재전달합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.handover.adapter.runner;
