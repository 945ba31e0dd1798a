package com.ryuqq.unwind.core.error;

/**
 * 설명만 가지는 기본 오류 값.
 *
 * <p>비교 가능한 sentinel 오류로도 사용합니다.</p>
 * <pre>
 * public static final ErrorValue NOT_FOUND = Errors.of("not found");
 *
 * if (Errors.is(err, NOT_FOUND)) { ... }
 * </pre>
 *
 * @param description 오류 설명
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public record SimpleError(String description) implements ErrorValue {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException description이 null이거나 빈 문자열인 경우
     */
    public SimpleError {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description cannot be null or blank");
        }
    }
}
