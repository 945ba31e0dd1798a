package com.ryuqq.unwind.core.defer;

/**
 * context 종료 시 실행될 정리 작업.
 *
 * <p>checked 예외를 던질 수 있습니다. 실행 중 빠져나온 모든 예외는 해당 context의 fault가 됩니다.</p>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DeferredAction {

    /**
     * 정리 작업 실행.
     *
     * @throws Exception 정리 작업 실패 시
     */
    void run() throws Exception;
}
