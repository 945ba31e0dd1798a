package com.ryuqq.unwind.core.error;

/**
 * 실패 결과.
 *
 * @param error 오류 값
 * @param <T> 성공 시 값 타입
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public record Err<T>(ErrorValue error) implements Result<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException error가 null인 경우
     */
    public Err {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }
}
