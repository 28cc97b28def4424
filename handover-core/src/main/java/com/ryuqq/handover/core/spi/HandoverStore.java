package com.ryuqq.handover.core.spi;

import com.ryuqq.handover.core.job.JobId;
import com.ryuqq.handover.core.job.JobKind;
import com.ryuqq.handover.core.model.HandoverRequest;
import com.ryuqq.handover.core.model.HandoverToken;
import com.ryuqq.handover.core.statemachine.HandoverStage;

import java.util.Optional;

/**
 * Persistent Store SPI for handover progress.
 *
 * <p>Records the current stage of each handover and the job id submitted for each
 * stage. Steps consult it before acting so that a redelivered step neither
 * re-submits a job nor moves a handover backwards.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe</li>
 *   <li>{@link #transition} validates with
 *       {@link com.ryuqq.handover.core.statemachine.StageTransition}</li>
 *   <li>{@link #recordJobId} is first-writer-wins</li>
 *   <li>A transition to a terminal stage ends tracking: the token is unknown afterwards</li>
 * </ul>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public interface HandoverStore {

    /**
     * Registers a newly accepted handover at {@link HandoverStage#INTAKE}.
     *
     * @param request the accepted request
     * @throws IllegalArgumentException if request is null
     * @throws IllegalStateException if the token is already registered
     */
    void register(HandoverRequest request);

    /**
     * Returns the current stage.
     *
     * @param token handover token
     * @return current stage, empty if the token is unknown
     */
    Optional<HandoverStage> findStage(HandoverToken token);

    /**
     * Moves a handover to the next stage.
     *
     * <p>When {@code next} is terminal the handover is dropped from the store once the
     * transition is applied.</p>
     *
     * @param token handover token
     * @param next the next stage
     * @throws IllegalStateException if the token is unknown or the transition is not allowed
     */
    void transition(HandoverToken token, HandoverStage next);

    /**
     * Drops a handover that will not progress, for example when intake failed after
     * registration. Unknown tokens are ignored.
     *
     * @param token handover token
     * @throws IllegalArgumentException if token is null
     */
    void remove(HandoverToken token);

    /**
     * Returns the job id recorded for a stage.
     *
     * @param token handover token
     * @param kind job kind
     * @return recorded job id, empty if none
     */
    Optional<JobId> findJobId(HandoverToken token, JobKind kind);

    /**
     * Records the job id for a stage unless one is already recorded.
     *
     * @param token handover token
     * @param kind job kind
     * @param jobId job id to record
     * @return the job id that is recorded after the call (the existing one if present)
     * @throws IllegalStateException if the token is unknown
     */
    JobId recordJobId(HandoverToken token, JobKind kind, JobId jobId);
}
