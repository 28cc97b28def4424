/**
 * Handover 상태 머신과 확장 지점.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.handover.application.coordinator.HandoverCoordinator} - 접수 및 CHECK_* step 처리</li>
 *   <li>{@link com.ryuqq.handover.application.coordinator.HandoverCompletionHandler} - 완료 시 호출되는 확장 지점</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.handover.application.coordinator;
