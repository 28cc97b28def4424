package com.ryuqq.handover.core.job;

import java.util.Locale;
import java.util.Optional;

/**
 * 외부 작업 서비스가 보고하는 작업 상태.
 *
 * <p>상태 어휘는 {@code submitted, running, incomplete, failed, succeeded}로 고정됩니다.</p>
 *
 * <pre>
 * SUBMITTED ─┐
 * RUNNING   ─┼─ pending (재예약 대상)
 * INCOMPLETE┘
 * FAILED      (작업 자체가 실행되지 못함)
 * SUCCEEDED   (실행 완료, output에 세부 결과)
 * </pre>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public enum JobState {

    SUBMITTED("submitted"),

    RUNNING("running"),

    INCOMPLETE("incomplete"),

    FAILED("failed"),

    SUCCEEDED("succeeded");

    private final String wireValue;

    JobState(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * 아직 끝나지 않은 상태인지 확인.
     *
     * @return SUBMITTED, RUNNING, INCOMPLETE인 경우 true
     */
    public boolean isPending() {
        return this == SUBMITTED || this == RUNNING || this == INCOMPLETE;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * 서비스 응답 문자열을 상태로 변환.
     *
     * <p>알 수 없는 값은 빈 Optional을 반환합니다. 호출자는 이를 "진행 중"으로 해석하면 안 됩니다.</p>
     *
     * @param value 응답의 status 값 (대소문자 무시)
     * @return 대응하는 상태
     */
    public static Optional<JobState> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (JobState state : values()) {
            if (state.wireValue.equals(normalized)) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }
}
