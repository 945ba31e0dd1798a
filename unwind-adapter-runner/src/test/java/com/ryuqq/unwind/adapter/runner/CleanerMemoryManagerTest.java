package com.ryuqq.unwind.adapter.runner;

import com.ryuqq.unwind.core.finalizer.DefaultFinalizerRegistry;
import com.ryuqq.unwind.core.finalizer.FinalizerBinding;
import com.ryuqq.unwind.core.spi.MemoryManager;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CleanerMemoryManager 테스트.
 *
 * <p>GC 시점은 결정적이지 않으므로 명시적 clean 경로만 검증합니다.</p>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
class CleanerMemoryManagerTest {

    private final CleanerMemoryManager memoryManager = new CleanerMemoryManager(runnable -> {
        Thread thread = new Thread(runnable, "unwind-cleaner-test");
        thread.setDaemon(true);
        return thread;
    });

    @Test
    void registration_clean은_callback을_정확히_1회_실행() {
        // given
        AtomicInteger calls = new AtomicInteger();
        Object referent = new Object();
        MemoryManager.Registration registration = memoryManager.track(referent, calls::incrementAndGet);

        // when
        registration.clean();
        registration.clean();

        // then
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void registration_callback_예외는_전파되지_않음() {
        // given
        MemoryManager.Registration registration = memoryManager.track(new Object(), () -> {
            throw new IllegalStateException("release failed");
        });

        // when & then (예외 없음)
        registration.clean();
    }

    @Test
    void registry와_함께_사용시_명시적_clean_후_pending_없음() {
        // given
        DefaultFinalizerRegistry registry = new DefaultFinalizerRegistry(memoryManager);
        AtomicInteger released = new AtomicInteger();
        Object owner = new Object();
        FinalizerBinding binding = registry.register(owner, released::incrementAndGet);

        // when
        binding.clean();

        // then
        assertThat(released.get()).isEqualTo(1);
        assertThat(registry.pendingCount()).isZero();
    }

    @Test
    void null_인자_거부() {
        assertThatThrownBy(() -> memoryManager.track(null, () -> { }))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> memoryManager.track(new Object(), null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CleanerMemoryManager((java.lang.ref.Cleaner) null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
