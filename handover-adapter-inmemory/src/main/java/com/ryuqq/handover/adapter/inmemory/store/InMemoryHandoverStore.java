package com.ryuqq.handover.adapter.inmemory.store;

import com.ryuqq.handover.core.job.JobId;
import com.ryuqq.handover.core.job.JobKind;
import com.ryuqq.handover.core.model.HandoverRequest;
import com.ryuqq.handover.core.model.HandoverToken;
import com.ryuqq.handover.core.spi.HandoverStore;
import com.ryuqq.handover.core.statemachine.HandoverStage;
import com.ryuqq.handover.core.statemachine.StageTransition;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link HandoverStore}.
 *
 * <p>Each handover is one entry guarded by its own monitor, so stage transitions
 * and job id recording for the same token are serialized while different
 * handovers proceed independently.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Entries are dropped on a terminal transition, so a late duplicate delivery
 *       sees an unknown token</li>
 * </ul>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class InMemoryHandoverStore implements HandoverStore {

    private final ConcurrentHashMap<HandoverToken, HandoverEntry> handovers = new ConcurrentHashMap<>();

    @Override
    public void register(HandoverRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        HandoverEntry existing = handovers.putIfAbsent(request.handoverToken(), new HandoverEntry(request));
        if (existing != null) {
            throw new IllegalStateException("Handover already registered: " + request.handoverToken());
        }
    }

    @Override
    public Optional<HandoverStage> findStage(HandoverToken token) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        HandoverEntry entry = handovers.get(token);
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            return Optional.of(entry.stage);
        }
    }

    @Override
    public void transition(HandoverToken token, HandoverStage next) {
        HandoverEntry entry = require(token);
        synchronized (entry) {
            entry.stage = StageTransition.transition(entry.stage, next);
            if (entry.stage.isTerminal()) {
                handovers.remove(token, entry);
            }
        }
    }

    @Override
    public void remove(HandoverToken token) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        handovers.remove(token);
    }

    @Override
    public Optional<JobId> findJobId(HandoverToken token, JobKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        HandoverEntry entry = handovers.get(token);
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            return Optional.ofNullable(entry.jobIds.get(kind));
        }
    }

    @Override
    public JobId recordJobId(HandoverToken token, JobKind kind, JobId jobId) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        HandoverEntry entry = require(token);
        synchronized (entry) {
            return entry.jobIds.computeIfAbsent(kind, k -> jobId);
        }
    }

    /**
     * Returns the request as registered at intake.
     */
    public Optional<HandoverRequest> findRequest(HandoverToken token) {
        HandoverEntry entry = handovers.get(token);
        return entry == null ? Optional.empty() : Optional.of(entry.request);
    }

    public int size() {
        return handovers.size();
    }

    public void clear() {
        handovers.clear();
    }

    private HandoverEntry require(HandoverToken token) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        HandoverEntry entry = handovers.get(token);
        if (entry == null) {
            throw new IllegalStateException("Unknown handover: " + token);
        }
        return entry;
    }

    private static final class HandoverEntry {

        private final HandoverRequest request;
        private final Map<JobKind, JobId> jobIds = new EnumMap<>(JobKind.class);
        private HandoverStage stage = HandoverStage.INTAKE;

        HandoverEntry(HandoverRequest request) {
            this.request = request;
        }
    }
}
