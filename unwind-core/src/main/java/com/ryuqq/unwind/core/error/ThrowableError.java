package com.ryuqq.unwind.core.error;

/**
 * Java 예외를 예상된 실패 값으로 변환한 오류.
 *
 * <p>IOException처럼 호출자가 처리할 수 있는 예외를 unwind 없이 반환할 때 사용합니다.</p>
 *
 * @param throwable 원본 예외
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public record ThrowableError(Throwable throwable) implements ErrorValue {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException throwable이 null인 경우
     */
    public ThrowableError {
        if (throwable == null) {
            throw new IllegalArgumentException("throwable cannot be null");
        }
    }

    @Override
    public String description() {
        String message = throwable.getMessage();
        return message != null ? message : throwable.getClass().getName();
    }
}
