package com.ryuqq.handover.core.classify;

import java.util.List;
import java.util.Optional;

/**
 * 데이터베이스 식별자를 검증 그룹으로 분류.
 *
 * <p>순서가 있는 규칙 목록을 앞에서부터 평가하며, 처음 매칭된 규칙의 그룹을 반환합니다.
 * 규칙끼리 상호 배타적이지 않으므로 선언 순서가 우선순위입니다.</p>
 *
 * <p><strong>표준 규칙 (선언 순서):</strong></p>
 * <ol>
 *   <li>{@code .*[a-z]_(core|rnaseq|cdna|otherfeatures)_[0-9].*} → core</li>
 *   <li>{@code .*[a-z]_variation_[0-9].*} → variation</li>
 *   <li>{@code .*[a-z]_funcgen_[0-9].*} → funcgen</li>
 *   <li>{@code .*[a-z]_compara_[0-9].*} → compara</li>
 * </ol>
 *
 * <p>부수 효과가 없고 thread-safe합니다.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public final class Classifier {

    private final List<ClassificationRule> rules;

    /**
     * 생성자.
     *
     * @param rules 평가 순서대로 정렬된 규칙
     * @throws IllegalArgumentException rules가 null이거나 null 요소를 포함한 경우
     */
    public Classifier(List<ClassificationRule> rules) {
        if (rules == null) {
            throw new IllegalArgumentException("rules cannot be null");
        }
        this.rules = List.copyOf(rules);
    }

    /**
     * 표준 규칙으로 Classifier 생성.
     *
     * @param groups 규칙별 그룹 설정
     * @return Classifier
     */
    public static Classifier standard(ValidationGroups groups) {
        if (groups == null) {
            throw new IllegalArgumentException("groups cannot be null");
        }
        return new Classifier(List.of(
            ClassificationRule.matching("core", ".*[a-z]_(core|rnaseq|cdna|otherfeatures)_[0-9].*", groups.core()),
            ClassificationRule.matching("variation", ".*[a-z]_variation_[0-9].*", groups.variation()),
            ClassificationRule.matching("funcgen", ".*[a-z]_funcgen_[0-9].*", groups.funcgen()),
            ClassificationRule.matching("compara", ".*[a-z]_compara_[0-9].*", groups.compara())
        ));
    }

    /**
     * 식별자 분류.
     *
     * @param identifier 데이터베이스 식별자 (URI 또는 이름)
     * @return 처음 매칭된 규칙의 그룹, 매칭되는 규칙이 없으면 빈 Optional
     * @throws IllegalArgumentException identifier가 null인 경우
     */
    public Optional<ValidationGroup> classify(String identifier) {
        if (identifier == null) {
            throw new IllegalArgumentException("identifier cannot be null");
        }
        for (ClassificationRule rule : rules) {
            if (rule.matches(identifier)) {
                return Optional.of(rule.group());
            }
        }
        return Optional.empty();
    }

    public List<ClassificationRule> rules() {
        return rules;
    }
}
