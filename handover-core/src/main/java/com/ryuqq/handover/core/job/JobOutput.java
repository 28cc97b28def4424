package com.ryuqq.handover.core.job;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 작업이 실행된 뒤 보고하는 세부 결과.
 *
 * <p>"작업이 실행되지 못함"(JobState.FAILED)과 "실행됐지만 문제를 발견함"(output.status = failed)을
 * 구분하기 위해 사용됩니다.</p>
 *
 * @param status 세부 상태 (예: failed, succeeded; null 가능)
 * @param attributes 서비스가 보고한 나머지 필드 (읽기 전용)
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record JobOutput(
    String status,
    Map<String, Object> attributes
) {

    public JobOutput {
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static JobOutput of(String status) {
        return new JobOutput(status, Map.of());
    }

    /**
     * 작업이 문제를 발견했는지 확인.
     *
     * @return status가 "failed"인 경우 true
     */
    public boolean isFailed() {
        return JobState.FAILED.wireValue().equalsIgnoreCase(status);
    }
}
