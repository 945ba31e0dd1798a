package com.ryuqq.unwind.core.finalizer;

import com.ryuqq.unwind.core.spi.MemoryManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * {@link MemoryManager} SPI 위에 구현한 FinalizerRegistry.
 *
 * <p>메모리 관리자의 도달 불가 통지를 registry callback으로 받는 메시지 전달 구조입니다.
 * 각 등록은 CAS 상태(PENDING → CLEANED | CANCELLED)로 최대 한 번 실행을 보장합니다.</p>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>메모리 관리자 스레드에서 실행된 cleanup의 예외: 로그 후 계속 진행 (다른 등록 처리를 방해하지 않음)</li>
 *   <li>{@link FinalizerBinding#clean()}에서 실행된 cleanup의 예외: 설정에 따라 호출자에게 전파</li>
 * </ul>
 *
 * <p><strong>스레드 안전성:</strong> 모든 메서드는 임의의 스레드에서 동시에 호출할 수 있습니다.</p>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public final class DefaultFinalizerRegistry implements FinalizerRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultFinalizerRegistry.class);

    private final MemoryManager memoryManager;
    private final FinalizerRegistryConfig config;
    private final AtomicInteger pending = new AtomicInteger();

    /**
     * 생성자 (기본 설정).
     *
     * @param memoryManager 메모리 관리자
     * @throws IllegalArgumentException memoryManager가 null인 경우
     */
    public DefaultFinalizerRegistry(MemoryManager memoryManager) {
        this(memoryManager, new FinalizerRegistryConfig());
    }

    /**
     * 생성자.
     *
     * @param memoryManager 메모리 관리자
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultFinalizerRegistry(MemoryManager memoryManager, FinalizerRegistryConfig config) {
        if (memoryManager == null) {
            throw new IllegalArgumentException("memoryManager cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.memoryManager = memoryManager;
        this.config = config;
    }

    @Override
    public FinalizerBinding register(Object owner, Runnable cleanup) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        if (cleanup == null) {
            throw new IllegalArgumentException("cleanup cannot be null");
        }
        if (cleanup == owner) {
            throw new IllegalArgumentException("cleanup cannot be the tracked object itself");
        }
        return bind(owner, cleanup);
    }

    @Override
    public <H> FinalizerBinding register(Object owner, H handle, Consumer<? super H> release) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (release == null) {
            throw new IllegalArgumentException("release cannot be null");
        }
        if (handle == owner) {
            throw new IllegalArgumentException("handle must be an internal resource handle, not the owner itself");
        }
        return bind(owner, () -> release.accept(handle));
    }

    @Override
    public int pendingCount() {
        return pending.get();
    }

    private FinalizerBinding bind(Object owner, Runnable cleanup) {
        Binding binding = new Binding(owner.getClass().getName(), cleanup);
        binding.attach(memoryManager.track(owner, binding::onUnreachable));

        int count = pending.incrementAndGet();
        if (count % config.pendingWarnThreshold() == 0) {
            log.warn("{} finalizer registrations pending; scoped resources should be released with defer", count);
        }
        log.debug("Finalizer registered for {}", binding.label());
        return binding;
    }

    private enum BindingState {
        PENDING,
        CLEANED,
        CANCELLED
    }

    private final class Binding implements FinalizerBinding {

        private final String label;
        private final Runnable cleanup;
        private final AtomicReference<BindingState> state = new AtomicReference<>(BindingState.PENDING);
        private volatile MemoryManager.Registration registration;

        private Binding(String label, Runnable cleanup) {
            this.label = label;
            this.cleanup = cleanup;
        }

        private void attach(MemoryManager.Registration registration) {
            this.registration = registration;
        }

        /**
         * 메모리 관리자 통지 (임의의 스레드).
         */
        private void onUnreachable() {
            if (!state.compareAndSet(BindingState.PENDING, BindingState.CLEANED)) {
                return;
            }
            pending.decrementAndGet();
            try {
                cleanup.run();
                log.debug("Finalizer cleanup completed for unreachable {}", label);
            } catch (RuntimeException e) {
                log.warn("Finalizer cleanup failed for unreachable {}", label, e);
            }
        }

        @Override
        public String label() {
            return label;
        }

        @Override
        public boolean clean() {
            if (!state.compareAndSet(BindingState.PENDING, BindingState.CLEANED)) {
                return false;
            }
            pending.decrementAndGet();
            try {
                cleanup.run();
            } catch (RuntimeException e) {
                if (config.rethrowOnExplicitClean()) {
                    throw e;
                }
                log.warn("Explicit finalizer cleanup failed for {}", label, e);
            } finally {
                release();
            }
            return true;
        }

        @Override
        public boolean cancel() {
            if (!state.compareAndSet(BindingState.PENDING, BindingState.CANCELLED)) {
                return false;
            }
            pending.decrementAndGet();
            release();
            log.debug("Finalizer cancelled for {}", label);
            return true;
        }

        @Override
        public boolean isPending() {
            return state.get() == BindingState.PENDING;
        }

        // 메모리 관리자 쪽 추적 해제. callback은 상태 검사로 무시됨
        private void release() {
            MemoryManager.Registration current = registration;
            if (current != null) {
                current.clean();
            }
        }

        @Override
        public String toString() {
            return "FinalizerBinding{" + label + ", " + state.get() + '}';
        }
    }
}
