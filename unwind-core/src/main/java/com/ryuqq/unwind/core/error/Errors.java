package com.ryuqq.unwind.core.error;

import java.util.Optional;

/**
 * ErrorValue 생성 및 판별 유틸리티.
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public final class Errors {

    private static final int MAX_CHAIN_DEPTH = 64;

    private Errors() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 설명만 가진 오류 생성.
     *
     * @param description 오류 설명
     * @return SimpleError 인스턴스
     */
    public static ErrorValue of(String description) {
        return new SimpleError(description);
    }

    /**
     * 문맥 메시지를 덧붙여 오류를 감쌈.
     *
     * @param error 원인 오류
     * @param message 문맥 메시지
     * @return WrappedError 인스턴스
     */
    public static ErrorValue wrap(ErrorValue error, String message) {
        return new WrappedError(message, error);
    }

    /**
     * 예외를 오류 값으로 변환.
     *
     * @param throwable 원본 예외
     * @return ThrowableError 인스턴스
     */
    public static ErrorValue fromThrowable(Throwable throwable) {
        return new ThrowableError(throwable);
    }

    /**
     * cause 체인 안에 target과 같은 오류가 있는지 확인.
     *
     * <p>동일 참조 또는 {@code equals}가 참이면 일치로 봅니다.</p>
     *
     * @param error 검사할 오류 (null이면 false)
     * @param target 찾을 오류
     * @return 체인 안에 존재하면 true
     */
    public static boolean is(ErrorValue error, ErrorValue target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        ErrorValue current = error;
        for (int depth = 0; current != null && depth < MAX_CHAIN_DEPTH; depth++) {
            if (current == target || current.equals(target)) {
                return true;
            }
            current = current.cause().orElse(null);
        }
        return false;
    }

    /**
     * cause 체인에서 지정한 타입의 첫 오류를 찾음.
     *
     * @param error 검사할 오류 (null이면 empty)
     * @param type 찾을 오류 타입
     * @param <E> 오류 타입
     * @return 첫 번째로 일치하는 오류, 없으면 empty
     */
    public static <E extends ErrorValue> Optional<E> as(ErrorValue error, Class<E> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        ErrorValue current = error;
        for (int depth = 0; current != null && depth < MAX_CHAIN_DEPTH; depth++) {
            if (type.isInstance(current)) {
                return Optional.of(type.cast(current));
            }
            current = current.cause().orElse(null);
        }
        return Optional.empty();
    }
}
