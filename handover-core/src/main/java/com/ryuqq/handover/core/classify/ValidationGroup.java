package com.ryuqq.handover.core.classify;

/**
 * 외부 검증 러너가 적용할 규칙 집합의 식별자.
 *
 * <p>Classifier가 할당하며 이후 변경되지 않습니다.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public final class ValidationGroup {

    private final String value;

    private ValidationGroup(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ValidationGroup cannot be null or blank");
        }
        this.value = value;
    }

    public static ValidationGroup of(String value) {
        return new ValidationGroup(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValidationGroup that = (ValidationGroup) o;
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
