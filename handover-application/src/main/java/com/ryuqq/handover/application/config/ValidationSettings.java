package com.ryuqq.handover.application.config;

import com.ryuqq.handover.core.classify.ValidationGroups;

/**
 * 검증 러너 제출 설정 (불변 record).
 *
 * @param productionUri production 데이터베이스 URI
 * @param comparaUri compara 마스터 데이터베이스 URI
 * @param liveUri live 서버 URI
 * @param dataFilesPath 데이터 파일 경로 (null 가능)
 * @param webUri 작업 결과 화면 URL prefix (작업 ID가 뒤에 붙음)
 * @param groups 데이터베이스 유형별 검증 그룹
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record ValidationSettings(
    String productionUri,
    String comparaUri,
    String liveUri,
    String dataFilesPath,
    String webUri,
    ValidationGroups groups
) {

    public ValidationSettings {
        if (productionUri == null || productionUri.isBlank()) {
            throw new IllegalArgumentException("productionUri cannot be null or blank");
        }
        if (comparaUri == null || comparaUri.isBlank()) {
            throw new IllegalArgumentException("comparaUri cannot be null or blank");
        }
        if (liveUri == null || liveUri.isBlank()) {
            throw new IllegalArgumentException("liveUri cannot be null or blank");
        }
        if (webUri == null || webUri.isBlank()) {
            throw new IllegalArgumentException("webUri cannot be null or blank");
        }
        if (groups == null) {
            groups = new ValidationGroups();
        }
    }

    /**
     * groups만 변경한 새 인스턴스 생성.
     */
    public ValidationSettings withGroups(ValidationGroups groups) {
        return new ValidationSettings(productionUri, comparaUri, liveUri, dataFilesPath, webUri, groups);
    }
}
