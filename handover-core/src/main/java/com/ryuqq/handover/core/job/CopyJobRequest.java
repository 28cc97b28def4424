package com.ryuqq.handover.core.job;

import java.util.List;

/**
 * 데이터베이스 복사 작업 제출 파라미터.
 *
 * @param sourceUri 원본 데이터베이스
 * @param targetUri 대상 데이터베이스
 * @param onlyTables 복사할 테이블 (비어 있으면 전체)
 * @param skipTables 제외할 테이블
 * @param update 기존 대상에 갱신만 할지 여부
 * @param drop 대상이 존재하면 삭제 후 복사할지 여부
 * @param email 러너가 직접 보낼 알림 주소 (null 가능)
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record CopyJobRequest(
    String sourceUri,
    String targetUri,
    List<String> onlyTables,
    List<String> skipTables,
    boolean update,
    boolean drop,
    String email
) {

    public CopyJobRequest {
        if (sourceUri == null || sourceUri.isBlank()) {
            throw new IllegalArgumentException("sourceUri cannot be null or blank");
        }
        if (targetUri == null || targetUri.isBlank()) {
            throw new IllegalArgumentException("targetUri cannot be null or blank");
        }
        onlyTables = onlyTables == null ? List.of() : List.copyOf(onlyTables);
        skipTables = skipTables == null ? List.of() : List.copyOf(skipTables);
    }

    /**
     * Handover 기본 복사: 전체 테이블, 대상 삭제 후 새로 복사.
     */
    public static CopyJobRequest replace(String sourceUri, String targetUri) {
        return new CopyJobRequest(sourceUri, targetUri, List.of(), List.of(), false, true, null);
    }
}
