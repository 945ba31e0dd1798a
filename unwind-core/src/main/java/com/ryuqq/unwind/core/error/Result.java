package com.ryuqq.unwind.core.error;

import com.ryuqq.unwind.core.context.InvocationContext;

import java.util.Optional;
import java.util.function.Function;

/**
 * 값 또는 예상된 실패를 반환값으로 전달하는 결과.
 *
 * <p>Result는 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 값과 함께 성공</li>
 *   <li>{@link Err}: {@link ErrorValue}와 함께 실패</li>
 * </ul>
 *
 * <p>전파는 수동입니다. 호출자가 직접 확인하고 다시 반환하거나 처리하며, unwind는 발생하지 않습니다.
 * 실패를 더 이상 계속할 수 없는 상황으로 승격하려면 {@link #orElseRaise(InvocationContext)}를 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Result&lt;Config&gt; result = loader.load(path);
 * if (result instanceof Err&lt;Config&gt; err) {
 *     return Result.err(Errors.wrap(err.error(), "load " + path));
 * }
 * Config config = ((Ok&lt;Config&gt;) result).value();
 * </pre>
 *
 * @param <T> 성공 값 타입
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public sealed interface Result<T> permits Ok, Err {

    /**
     * 성공 결과 생성.
     *
     * @param value 값 (null 허용)
     * @param <T> 값 타입
     * @return Ok 인스턴스
     */
    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    /**
     * 실패 결과 생성.
     *
     * @param error 오류 값
     * @param <T> 값 타입
     * @return Err 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    static <T> Result<T> err(ErrorValue error) {
        return new Err<>(error);
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isErr() {
        return this instanceof Err;
    }

    /**
     * 실패 시 오류 값.
     *
     * @return Err이면 오류 값, Ok이면 empty
     */
    default Optional<ErrorValue> failure() {
        return this instanceof Err<T> err ? Optional.of(err.error()) : Optional.empty();
    }

    /**
     * 성공 값 변환.
     *
     * @param mapper 변환 함수
     * @param <U> 변환된 값 타입
     * @return 변환된 Ok, 또는 같은 오류의 Err
     */
    default <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (this instanceof Ok<T> ok) {
            return new Ok<>(mapper.apply(ok.value()));
        }
        return new Err<>(((Err<T>) this).error());
    }

    /**
     * 실패할 수 있는 후속 작업 연결.
     *
     * @param mapper 후속 작업
     * @param <U> 후속 결과 값 타입
     * @return 후속 작업 결과, 또는 같은 오류의 Err
     */
    default <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (this instanceof Ok<T> ok) {
            Result<U> next = mapper.apply(ok.value());
            if (next == null) {
                throw new IllegalStateException("mapper returned null Result");
            }
            return next;
        }
        return new Err<>(((Err<T>) this).error());
    }

    /**
     * 성공 값 또는 대체값.
     *
     * @param fallback 실패 시 반환할 값
     * @return 성공 값 또는 fallback
     */
    default T orElse(T fallback) {
        return this instanceof Ok<T> ok ? ok.value() : fallback;
    }

    /**
     * 성공 값을 반환하거나, 실패면 오류 값을 payload로 fault를 발생시킴.
     *
     * @param context fault를 발생시킬 context
     * @return 성공 값
     */
    default T orElseRaise(InvocationContext<?> context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        throw context.raise(((Err<T>) this).error());
    }
}
