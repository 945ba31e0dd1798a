package com.ryuqq.unwind.core.defer;

import com.ryuqq.unwind.core.context.InvocationContext;

import java.util.concurrent.locks.Lock;

/**
 * 획득 직후 해제를 예약하는 관용구 모음.
 *
 * <p>해제 작업은 획득이 성공한 직후, 실패할 수 있는 어떤 작업보다 먼저 예약됩니다.
 * 따라서 fault를 포함한 모든 종료 경로에서 해제가 보장됩니다.</p>
 *
 * <pre>
 * invoker.run("update", ctx -&gt; {
 *     DeferredResources.lock(ctx, mapLock);
 *     Writer out = DeferredResources.closing(ctx, Files.newBufferedWriter(path));
 *     out.write(render(map));   // 여기서 fault가 나도 close → unlock 순서로 실행
 *     return null;
 * });
 * </pre>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public final class DeferredResources {

    private DeferredResources() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * lock을 획득하고 즉시 unlock을 예약.
     *
     * @param context 현재 context
     * @param lock 획득할 lock
     * @param <L> lock 타입
     * @return 획득한 lock
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <L extends Lock> L lock(InvocationContext<?> context, L lock) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (lock == null) {
            throw new IllegalArgumentException("lock cannot be null");
        }
        lock.lock();
        try {
            context.defer("unlock " + lock, lock::unlock);
        } catch (RuntimeException e) {
            // 예약 실패 시 lock을 쥔 채로 빠져나가지 않음
            lock.unlock();
            throw e;
        }
        return lock;
    }

    /**
     * 자원의 close를 예약하고 자원을 그대로 반환.
     *
     * @param context 현재 context
     * @param resource 닫을 자원
     * @param <C> 자원 타입
     * @return 전달받은 자원
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <C extends AutoCloseable> C closing(InvocationContext<?> context, C resource) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        try {
            context.defer("close " + resource.getClass().getSimpleName(), resource::close);
        } catch (RuntimeException e) {
            try {
                resource.close();
            } catch (Exception closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        return resource;
    }
}
