package com.ryuqq.handover.testkit.store;

import com.ryuqq.handover.core.job.JobId;
import com.ryuqq.handover.core.job.JobKind;
import com.ryuqq.handover.core.model.HandoverRequest;
import com.ryuqq.handover.core.model.HandoverToken;
import com.ryuqq.handover.core.spi.HandoverStore;
import com.ryuqq.handover.core.statemachine.HandoverStage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link HandoverStore} decorator that keeps the stage history of every token.
 *
 * <p>Stores drop a handover on its terminal transition, so tests read the final
 * outcome from {@link #lastStage(HandoverToken)} instead of {@code findStage}.
 * Only transitions the delegate accepted are recorded.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class RecordingHandoverStore implements HandoverStore {

    private final HandoverStore delegate;
    private final Map<HandoverToken, List<HandoverStage>> history = new ConcurrentHashMap<>();
    private final List<HandoverToken> removed = Collections.synchronizedList(new ArrayList<>());

    public RecordingHandoverStore(HandoverStore delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    @Override
    public void register(HandoverRequest request) {
        delegate.register(request);
        stagesOf(request.handoverToken()).add(HandoverStage.INTAKE);
    }

    @Override
    public Optional<HandoverStage> findStage(HandoverToken token) {
        return delegate.findStage(token);
    }

    @Override
    public void transition(HandoverToken token, HandoverStage next) {
        delegate.transition(token, next);
        stagesOf(token).add(next);
    }

    @Override
    public void remove(HandoverToken token) {
        delegate.remove(token);
        removed.add(token);
    }

    @Override
    public Optional<JobId> findJobId(HandoverToken token, JobKind kind) {
        return delegate.findJobId(token, kind);
    }

    @Override
    public JobId recordJobId(HandoverToken token, JobKind kind, JobId jobId) {
        return delegate.recordJobId(token, kind, jobId);
    }

    /**
     * Stages the token went through, starting with INTAKE.
     */
    public List<HandoverStage> history(HandoverToken token) {
        List<HandoverStage> stages = history.get(token);
        if (stages == null) {
            return List.of();
        }
        synchronized (stages) {
            return List.copyOf(stages);
        }
    }

    /**
     * Last stage reached, including a terminal stage the delegate has already dropped.
     */
    public Optional<HandoverStage> lastStage(HandoverToken token) {
        List<HandoverStage> stages = history(token);
        return stages.isEmpty() ? Optional.empty() : Optional.of(stages.get(stages.size() - 1));
    }

    public boolean wasRemoved(HandoverToken token) {
        return removed.contains(token);
    }

    private List<HandoverStage> stagesOf(HandoverToken token) {
        return history.computeIfAbsent(token, t -> Collections.synchronizedList(new ArrayList<>()));
    }
}
