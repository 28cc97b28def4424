package com.ryuqq.handover.core.job;

/**
 * 메타데이터 갱신 작업 제출 파라미터.
 *
 * @param databaseUri 등록할 (복사 완료된) 데이터베이스
 * @param release 릴리스 번호 (null 가능)
 * @param divisionRelease 부문 릴리스 번호 (null 가능)
 * @param releaseDate 릴리스 날짜 (null 가능)
 * @param currentRelease 현재 릴리스 여부
 * @param email 제출자 주소
 * @param comment 제출 설명 (null 가능)
 * @param source 갱신 출처 (예: Handover)
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record MetadataJobRequest(
    String databaseUri,
    String release,
    String divisionRelease,
    String releaseDate,
    boolean currentRelease,
    String email,
    String comment,
    String source
) {

    public MetadataJobRequest {
        if (databaseUri == null || databaseUri.isBlank()) {
            throw new IllegalArgumentException("databaseUri cannot be null or blank");
        }
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source cannot be null or blank");
        }
    }
}
