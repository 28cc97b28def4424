package com.ryuqq.handover.core.model;

import java.util.UUID;

/**
 * Handover 요청의 전역 고유 식별자.
 *
 * <p>HandoverToken은 접수(intake) 시점에 한 번만 발급되며,
 * 이후 모든 단계에서 동일한 값이 유지됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자</li>
 *   <li>패턴: 영숫자, 하이픈(-)만 허용</li>
 * </ul>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public final class HandoverToken {

    private final String value;

    private HandoverToken(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("HandoverToken cannot be null or blank");
        }
        if (value.length() > 64) {
            throw new IllegalArgumentException("HandoverToken length cannot exceed 64 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-]+$")) {
            throw new IllegalArgumentException("HandoverToken contains invalid characters. Only alphanumeric and hyphen are allowed");
        }
        this.value = value;
    }

    /**
     * 기존 값으로 HandoverToken 복원.
     *
     * @param value 토큰 값
     * @return HandoverToken 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static HandoverToken of(String value) {
        return new HandoverToken(value);
    }

    /**
     * 새 HandoverToken 발급 (UUID 기반).
     *
     * @return 새로 발급된 HandoverToken
     */
    public static HandoverToken generate() {
        return new HandoverToken(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HandoverToken that = (HandoverToken) o;
        return value.equals(that.value);
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
