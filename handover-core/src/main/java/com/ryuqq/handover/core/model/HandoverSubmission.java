package com.ryuqq.handover.core.model;

/**
 * 제출자가 보내는 Handover 접수 요청.
 *
 * <p>토큰이 발급되기 전의 원본 입력이며, 필드 검증은 접수 단계에서 수행됩니다.</p>
 *
 * @param sourceUri 넘겨받을 데이터베이스 URI (필수)
 * @param targetUri 복사 대상 URI (선택, null이면 staging 위치와 데이터베이스 이름으로 생성)
 * @param contact 알림 수신자 (필수)
 * @param changeType 변경 유형 (필수)
 * @param comment 추가 설명 (선택)
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record HandoverSubmission(
    String sourceUri,
    String targetUri,
    String contact,
    String changeType,
    String comment
) {

    /**
     * targetUri 없이 생성.
     */
    public static HandoverSubmission of(String sourceUri, String contact, String changeType, String comment) {
        return new HandoverSubmission(sourceUri, null, contact, changeType, comment);
    }

    public boolean hasTargetUri() {
        return targetUri != null && !targetUri.isBlank();
    }
}
