package com.ryuqq.handover.core.classify;

/**
 * 데이터베이스 유형별 검증 그룹 설정 (불변 record).
 *
 * <p>기본값: CoreHandover, VariationHandover, FuncgenHandover, ComparaHandover</p>
 *
 * @param core core/rnaseq/cdna/otherfeatures 데이터베이스용 그룹
 * @param variation variation 데이터베이스용 그룹
 * @param funcgen funcgen 데이터베이스용 그룹
 * @param compara compara 데이터베이스용 그룹
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record ValidationGroups(
    ValidationGroup core,
    ValidationGroup variation,
    ValidationGroup funcgen,
    ValidationGroup compara
) {

    /**
     * 기본 그룹 이름으로 생성.
     */
    public ValidationGroups() {
        this(
            ValidationGroup.of("CoreHandover"),
            ValidationGroup.of("VariationHandover"),
            ValidationGroup.of("FuncgenHandover"),
            ValidationGroup.of("ComparaHandover")
        );
    }

    public ValidationGroups {
        if (core == null || variation == null || funcgen == null || compara == null) {
            throw new IllegalArgumentException("validation groups cannot be null");
        }
    }
}
