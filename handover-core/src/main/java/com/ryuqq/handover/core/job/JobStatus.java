package com.ryuqq.handover.core.job;

/**
 * 작업 상태 조회 결과.
 *
 * <p>Coordinator 입장에서는 읽기 전용 값입니다.</p>
 *
 * @param state 작업 상태
 * @param output 세부 결과 (null 가능)
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record JobStatus(
    JobState state,
    JobOutput output
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException state가 null인 경우
     */
    public JobStatus {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        // output은 null 허용
    }

    public static JobStatus of(JobState state) {
        return new JobStatus(state, null);
    }

    public static JobStatus of(JobState state, JobOutput output) {
        return new JobStatus(state, output);
    }

    public boolean isPending() {
        return state.isPending();
    }

    public boolean hasOutput() {
        return output != null;
    }
}
