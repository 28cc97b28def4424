package com.ryuqq.handover.core.model;

import com.ryuqq.handover.core.contract.StepPayload;
import com.ryuqq.handover.core.job.JobId;
import com.ryuqq.handover.core.job.JobKind;

/**
 * 파이프라인을 따라 이동하는 Handover 요청 스냅샷.
 *
 * <p>접수 시점에 생성되며, Coordinator만 작업 ID를 추가한 새 스냅샷을 만듭니다.
 * 기존 인스턴스는 절대 변경되지 않습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>handoverToken, targetUri는 생성 시 확정되며 이후 재계산되지 않음</li>
 *   <li>각 작업 ID는 한 번만 설정 가능 (다른 값으로 덮어쓰기 시 IllegalStateException)</li>
 * </ul>
 *
 * @param sourceUri 원본 데이터베이스 URI
 * @param targetUri 복사 대상 URI
 * @param contact 알림 수신자
 * @param changeType 변경 유형
 * @param comment 추가 설명 (null 가능)
 * @param handoverToken Handover 토큰
 * @param validationJobId 검증 작업 ID (null 가능)
 * @param copyJobId 복사 작업 ID (null 가능)
 * @param metadataJobId 메타데이터 작업 ID (null 가능)
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record HandoverRequest(
    String sourceUri,
    String targetUri,
    String contact,
    String changeType,
    String comment,
    HandoverToken handoverToken,
    JobId validationJobId,
    JobId copyJobId,
    JobId metadataJobId
) implements StepPayload {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 빈 문자열인 경우
     */
    public HandoverRequest {
        requireText(sourceUri, "sourceUri");
        requireText(targetUri, "targetUri");
        requireText(contact, "contact");
        requireText(changeType, "changeType");
        if (handoverToken == null) {
            throw new IllegalArgumentException("handoverToken cannot be null");
        }
        // comment, 작업 ID들은 null 허용
    }

    /**
     * 접수 직후의 요청 생성 (작업 ID 없음).
     */
    public static HandoverRequest accepted(
        String sourceUri,
        String targetUri,
        String contact,
        String changeType,
        String comment,
        HandoverToken handoverToken
    ) {
        return new HandoverRequest(sourceUri, targetUri, contact, changeType, comment, handoverToken, null, null, null);
    }

    /**
     * 종류별 작업 ID 조회.
     *
     * @param kind 작업 종류
     * @return 작업 ID (설정되지 않았으면 null)
     */
    public JobId jobId(JobKind kind) {
        return switch (kind) {
            case VALIDATION -> validationJobId;
            case COPY -> copyJobId;
            case METADATA -> metadataJobId;
        };
    }

    /**
     * 작업 ID가 설정된 새 스냅샷 반환.
     *
     * <p>같은 값이 이미 설정되어 있으면 현재 인스턴스를 그대로 반환합니다.</p>
     *
     * @param kind 작업 종류
     * @param jobId 작업 ID
     * @return 새 스냅샷
     * @throws IllegalArgumentException jobId가 null인 경우
     * @throws IllegalStateException 다른 작업 ID가 이미 설정된 경우
     */
    public HandoverRequest withJobId(JobKind kind, JobId jobId) {
        if (kind == null || jobId == null) {
            throw new IllegalArgumentException("kind and jobId cannot be null");
        }
        JobId existing = jobId(kind);
        if (existing != null) {
            if (existing.equals(jobId)) {
                return this;
            }
            throw new IllegalStateException(
                String.format("%s job already recorded for %s: %s (attempted: %s)", kind, handoverToken, existing, jobId)
            );
        }
        return switch (kind) {
            case VALIDATION -> new HandoverRequest(sourceUri, targetUri, contact, changeType, comment, handoverToken,
                jobId, copyJobId, metadataJobId);
            case COPY -> new HandoverRequest(sourceUri, targetUri, contact, changeType, comment, handoverToken,
                validationJobId, jobId, metadataJobId);
            case METADATA -> new HandoverRequest(sourceUri, targetUri, contact, changeType, comment, handoverToken,
                validationJobId, copyJobId, jobId);
        };
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
