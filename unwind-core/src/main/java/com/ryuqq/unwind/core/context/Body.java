package com.ryuqq.unwind.core.context;

/**
 * InvocationContext 안에서 실행되는 본문.
 *
 * @param <T> 반환 타입
 *
 * @author Unwind Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Body<T> {

    /**
     * 본문 실행.
     *
     * <p>빠져나온 모든 예외는 이 context의 fault가 됩니다.</p>
     *
     * @param context 이 본문을 소유한 context
     * @return 반환값
     * @throws Exception 본문 실패 시
     */
    T apply(InvocationContext<T> context) throws Exception;
}
