package com.ryuqq.handover.application.config;

/**
 * 메타데이터 갱신 제출 설정 (불변 record).
 *
 * @param release 릴리스 번호 (null 가능)
 * @param divisionRelease 부문 릴리스 번호 (null 가능)
 * @param releaseDate 릴리스 날짜 (null 가능)
 * @param currentRelease 현재 릴리스 여부
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record MetadataSettings(
    String release,
    String divisionRelease,
    String releaseDate,
    boolean currentRelease
) {

    /**
     * 기본 설정: 릴리스 정보 없음, 현재 릴리스.
     */
    public MetadataSettings() {
        this(null, null, null, true);
    }
}
