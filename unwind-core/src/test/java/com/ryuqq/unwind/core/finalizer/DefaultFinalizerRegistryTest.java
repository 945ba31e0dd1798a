package com.ryuqq.unwind.core.finalizer;

import com.ryuqq.unwind.core.spi.MemoryManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.*;

/**
 * DefaultFinalizerRegistry 유닛 테스트.
 *
 * <p>메모리 관리자 통지와 명시적 clean/cancel의 상호작용을 검증합니다:</p>
 * <ul>
 *   <li>통지 시 cleanup 1회 실행</li>
 *   <li>명시적 clean 후 통지는 무시</li>
 *   <li>cleanup 예외 처리 (통지: 로그, clean: 설정에 따라 전파)</li>
 *   <li>owner 자신을 캡처하는 등록 거부</li>
 * </ul>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DefaultFinalizerRegistryTest {

    @Mock
    private MemoryManager memoryManager;

    @Mock
    private MemoryManager.Registration registration;

    private DefaultFinalizerRegistry registry;
    private List<String> events;

    @BeforeEach
    void setUp() {
        registry = new DefaultFinalizerRegistry(memoryManager);
        events = new ArrayList<>();
    }

    // ============================================================
    // 1. 도달 불가 통지
    // ============================================================

    @Test
    void 통지되면_cleanup_1회_실행되고_pending_감소() {
        // given
        Object owner = new Object();
        when(memoryManager.track(same(owner), any())).thenReturn(registration);
        FinalizerBinding binding = registry.register(owner, () -> events.add("released"));
        Runnable callback = capturedCallback(owner);

        // when
        callback.run();
        callback.run();

        // then
        assertThat(events).containsExactly("released");
        assertThat(binding.isPending()).isFalse();
        assertThat(registry.pendingCount()).isZero();
    }

    @Test
    void 통지_중_cleanup_예외는_로그_후_계속() {
        // given
        Object owner = new Object();
        when(memoryManager.track(same(owner), any())).thenReturn(registration);
        registry.register(owner, () -> {
            throw new IllegalStateException("release failed");
        });
        Runnable callback = capturedCallback(owner);

        // when & then (예외 전파 없음)
        callback.run();
        assertThat(registry.pendingCount()).isZero();
    }

    // ============================================================
    // 2. 명시적 clean / cancel
    // ============================================================

    @Test
    void clean_cleanup_실행하고_추적_해제_이후_통지는_무시() {
        // given
        Object owner = new Object();
        when(memoryManager.track(same(owner), any())).thenReturn(registration);
        FinalizerBinding binding = registry.register(owner, () -> events.add("released"));
        Runnable callback = capturedCallback(owner);

        // when
        boolean cleaned = binding.clean();
        callback.run();

        // then
        assertThat(cleaned).isTrue();
        assertThat(events).containsExactly("released");
        verify(registration).clean();
    }

    @Test
    void cancel_cleanup_실행하지_않고_추적_해제() {
        // given
        Object owner = new Object();
        when(memoryManager.track(same(owner), any())).thenReturn(registration);
        FinalizerBinding binding = registry.register(owner, () -> events.add("released"));

        // when
        boolean cancelled = binding.cancel();

        // then
        assertThat(cancelled).isTrue();
        assertThat(binding.cancel()).isFalse();
        assertThat(binding.clean()).isFalse();
        assertThat(events).isEmpty();
        verify(registration, times(1)).clean();
    }

    @Test
    void clean_예외는_기본_설정에서_호출자에게_전파되고_추적은_해제() {
        // given
        Object owner = new Object();
        when(memoryManager.track(same(owner), any())).thenReturn(registration);
        FinalizerBinding binding = registry.register(owner, () -> {
            throw new IllegalStateException("release failed");
        });

        // when & then
        assertThatThrownBy(binding::clean)
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("release failed");
        verify(registration).clean();
        assertThat(binding.isPending()).isFalse();
    }

    @Test
    void clean_예외는_rethrow_비활성화시_로그만() {
        // given
        registry = new DefaultFinalizerRegistry(memoryManager,
            new FinalizerRegistryConfig().withRethrowOnExplicitClean(false));
        Object owner = new Object();
        when(memoryManager.track(same(owner), any())).thenReturn(registration);
        FinalizerBinding binding = registry.register(owner, () -> {
            throw new IllegalStateException("release failed");
        });

        // when
        boolean cleaned = binding.clean();

        // then
        assertThat(cleaned).isTrue();
        verify(registration).clean();
    }

    // ============================================================
    // 3. handle 등록 및 검증
    // ============================================================

    @Test
    void handle_등록시_release가_handle을_받음() {
        // given
        Object owner = new Object();
        String handle = "fd-3";
        when(memoryManager.track(same(owner), any())).thenReturn(registration);
        FinalizerBinding binding = registry.register(owner, handle, h -> events.add("close " + h));

        // when
        binding.clean();

        // then
        assertThat(events).containsExactly("close fd-3");
        assertThat(binding.label()).isEqualTo(Object.class.getName());
    }

    @Test
    void owner_자신을_cleanup이나_handle로_등록하면_거부() {
        // given
        Runnable self = () -> events.add("self");
        Object owner = new Object();

        // when & then
        assertThatThrownBy(() -> registry.register(self, self))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register(owner, owner, o -> events.add("self")))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(memoryManager);
    }

    @Test
    void null_인자는_거부() {
        assertThatThrownBy(() -> new DefaultFinalizerRegistry(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register(null, () -> { }))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register(new Object(), null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private Runnable capturedCallback(Object owner) {
        ArgumentCaptor<Runnable> captor = ArgumentCaptor.forClass(Runnable.class);
        verify(memoryManager).track(same(owner), captor.capture());
        return captor.getValue();
    }
}
