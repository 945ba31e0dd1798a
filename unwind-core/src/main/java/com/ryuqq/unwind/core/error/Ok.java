package com.ryuqq.unwind.core.error;

/**
 * 성공 결과.
 *
 * @param value 값 (null 허용, 예: Void 작업)
 * @param <T> 값 타입
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public record Ok<T>(T value) implements Result<T> {
}
