package com.ryuqq.unwind.testkit.contract;

import com.ryuqq.unwind.core.defer.DeferredResources;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for scoped resource release.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>A lock taken with a deferred unlock is released before the fault leaves the context</li>
 *   <li>Resources are closed in reverse acquisition order</li>
 *   <li>Another thread can take the lock once the faulting call has returned</li>
 * </ul>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
class LockReleaseContractTest extends AbstractContractTest {

    @Test
    void testLockRelease_FaultWhileHoldingLock_ReleasedBeforePropagation() {
        // Given
        ReentrantLock mapLock = new ReentrantLock();

        // When
        invoker.run("main", ctx -> {
            ctx.defer(() -> ctx.recover().ifPresent(fault ->
                record("outer sees locked=" + mapLock.isLocked())));
            return ctx.call("update", update -> {
                DeferredResources.lock(update, mapLock);
                record("inner holds=" + mapLock.isHeldByCurrentThread());
                throw update.raise("write failed");
            });
        });

        // Then
        assertTrace("inner holds=true", "outer sees locked=false");
        assertFalse(mapLock.isLocked());
    }

    @Test
    void testLockRelease_LockAndResource_ClosedInReverseOrder() {
        // Given
        TracingLock lock = new TracingLock();
        AutoCloseable resource = () -> record("close");

        // When
        runExpectingFatal("main", ctx -> {
            DeferredResources.lock(ctx, lock);
            DeferredResources.closing(ctx, resource);
            throw ctx.raise("boom");
        });

        // Then
        assertTrace("close", "unlock");
        assertFalse(lock.isLocked());
    }

    @Test
    void testLockRelease_AfterFaultingCall_OtherThreadAcquiresLock() throws Exception {
        // Given
        ReentrantLock sharedLock = new ReentrantLock();
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            // When
            invoker.attempt("update", ctx -> {
                DeferredResources.lock(ctx, sharedLock);
                throw ctx.raise("write failed");
            });
            Future<Boolean> acquired = executor.submit(() -> {
                boolean locked = sharedLock.tryLock(1, TimeUnit.SECONDS);
                if (locked) {
                    sharedLock.unlock();
                }
                return locked;
            });

            // Then
            assertTrue(acquired.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }

    private final class TracingLock extends ReentrantLock {

        @Override
        public void unlock() {
            record("unlock");
            super.unlock();
        }
    }
}
