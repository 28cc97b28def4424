package com.ryuqq.handover.core.classify;

import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * (조건, 그룹) 쌍으로 이루어진 분류 규칙.
 *
 * @param name 규칙 이름 (로깅용)
 * @param predicate 식별자 매칭 조건
 * @param group 매칭 시 할당할 그룹
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record ClassificationRule(
    String name,
    Predicate<String> predicate,
    ValidationGroup group
) {

    public ClassificationRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        if (group == null) {
            throw new IllegalArgumentException("group cannot be null");
        }
    }

    /**
     * 정규식 전체 매칭 규칙 생성.
     *
     * @param name 규칙 이름
     * @param regex 식별자 전체와 매칭되어야 하는 정규식
     * @param group 할당할 그룹
     * @return 규칙
     */
    public static ClassificationRule matching(String name, String regex, ValidationGroup group) {
        Pattern pattern = Pattern.compile(regex);
        return new ClassificationRule(name, identifier -> pattern.matcher(identifier).matches(), group);
    }

    public boolean matches(String identifier) {
        return predicate.test(identifier);
    }
}
