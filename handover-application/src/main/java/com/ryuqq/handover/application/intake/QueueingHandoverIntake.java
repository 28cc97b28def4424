package com.ryuqq.handover.application.intake;

import com.ryuqq.handover.application.coordinator.HandoverCoordinator;
import com.ryuqq.handover.application.scheduling.StepScheduler;
import com.ryuqq.handover.core.model.HandoverRequest;
import com.ryuqq.handover.core.model.HandoverSubmission;
import com.ryuqq.handover.core.model.HandoverToken;
import com.ryuqq.handover.core.outcome.Advance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coordinator로 접수하고 첫 확인 step을 큐에 등록하는 HandoverIntake.
 *
 * <p>첫 step 등록이 실패하면 handover를 추적에서 제외하고 예외를 호출자에게 전파합니다.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class QueueingHandoverIntake implements HandoverIntake {

    private static final Logger log = LoggerFactory.getLogger(QueueingHandoverIntake.class);

    private final HandoverCoordinator coordinator;
    private final StepScheduler scheduler;

    public QueueingHandoverIntake(HandoverCoordinator coordinator, StepScheduler scheduler) {
        if (coordinator == null) {
            throw new IllegalArgumentException("coordinator cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.coordinator = coordinator;
        this.scheduler = scheduler;
    }

    @Override
    public HandoverToken submit(HandoverSubmission submission) {
        Advance first = coordinator.accept(submission);
        HandoverToken token = ((HandoverRequest) first.payload()).handoverToken();
        try {
            scheduler.enqueue(first.next(), first.payload(), 0);
        } catch (RuntimeException e) {
            log.error("Could not queue {} for handover {}", first.next(), token, e);
            coordinator.abandon(token);
            throw e;
        }
        return token;
    }
}
