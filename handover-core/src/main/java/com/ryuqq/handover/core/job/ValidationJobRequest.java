package com.ryuqq.handover.core.job;

import java.util.List;

/**
 * Health-check 검증 작업 제출 파라미터.
 *
 * @param databaseUri 검증할 데이터베이스
 * @param productionUri production 데이터베이스
 * @param comparaUri compara 마스터 데이터베이스
 * @param stagingUri staging 서버
 * @param liveUri live 서버
 * @param healthcheckNames 개별 실행할 검사 이름 (비어 있으면 그룹만 사용)
 * @param groups 실행할 검사 그룹
 * @param dataFilesPath 데이터 파일 경로 (null 가능)
 * @param email 러너가 직접 보낼 알림 주소 (null 가능)
 * @param tag 작업 태그 (null 가능)
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record ValidationJobRequest(
    String databaseUri,
    String productionUri,
    String comparaUri,
    String stagingUri,
    String liveUri,
    List<String> healthcheckNames,
    List<String> groups,
    String dataFilesPath,
    String email,
    String tag
) {

    public ValidationJobRequest {
        if (databaseUri == null || databaseUri.isBlank()) {
            throw new IllegalArgumentException("databaseUri cannot be null or blank");
        }
        healthcheckNames = healthcheckNames == null ? List.of() : List.copyOf(healthcheckNames);
        groups = groups == null ? List.of() : List.copyOf(groups);
    }
}
