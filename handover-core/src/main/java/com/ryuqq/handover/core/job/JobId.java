package com.ryuqq.handover.core.job;

/**
 * 외부 작업 서비스가 발급한 작업 식별자.
 *
 * <p>서비스마다 숫자 또는 문자열 ID를 사용하므로 문자열로 보관합니다.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public final class JobId {

    private final String value;

    private JobId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("JobId cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * JobId 생성.
     *
     * @param value 작업 ID
     * @return JobId 인스턴스
     * @throws IllegalArgumentException null 또는 빈 문자열인 경우
     */
    public static JobId of(String value) {
        return new JobId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobId jobId = (JobId) o;
        return value.equals(jobId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
