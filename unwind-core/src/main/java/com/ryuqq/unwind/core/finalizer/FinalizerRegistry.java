package com.ryuqq.unwind.core.finalizer;

import java.util.function.Consumer;

/**
 * 도달 가능성 기반 정리 작업 등록소.
 *
 * <p>소유권이 분산된 자원을 위한 보조 수단입니다. 범위가 명확한 자원은
 * {@link com.ryuqq.unwind.core.context.InvocationContext#defer(com.ryuqq.unwind.core.defer.DeferredAction)}로
 * 해제해야 하며, finalizer를 주 해제 경로로 사용해서는 안 됩니다.</p>
 *
 * <p><strong>보장하지 않는 것:</strong></p>
 * <ul>
 *   <li>실행 시점 (메모리 관리자가 결정)</li>
 *   <li>다른 finalizer와의 실행 순서</li>
 *   <li>실행 스레드</li>
 * </ul>
 *
 * <p><strong>보장하는 것:</strong></p>
 * <ul>
 *   <li>cleanup은 최대 한 번 실행 (명시적 clean과 메모리 관리자 호출 중 먼저 도착한 쪽)</li>
 *   <li>메모리 관리자가 호출한 cleanup의 실패는 로그로 남고 전파되지 않음</li>
 * </ul>
 *
 * <p><strong>안정된 핸들 규칙:</strong> cleanup은 wrapper 객체가 아니라 내부 자원 핸들을 통해 동작해야 합니다.
 * wrapper가 먼저 수거되거나 덮어써져도 자원이 고아가 되지 않도록 {@link #register(Object, Object, Consumer)}
 * 사용을 권장합니다.</p>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public interface FinalizerRegistry {

    /**
     * owner가 도달 불가능해지면 cleanup 실행.
     *
     * @param owner 추적할 객체
     * @param cleanup 정리 작업 (owner를 참조하면 안 됨)
     * @return 등록 핸들
     * @throws IllegalArgumentException 인자가 null이거나 cleanup이 owner 자신인 경우
     */
    FinalizerBinding register(Object owner, Runnable cleanup);

    /**
     * owner가 도달 불가능해지면 내부 핸들로 release 실행.
     *
     * @param owner 추적할 wrapper 객체
     * @param handle 자원에 대한 안정된 내부 핸들 (owner와 달라야 함)
     * @param release 핸들을 받아 자원을 해제하는 작업
     * @param <H> 핸들 타입
     * @return 등록 핸들
     * @throws IllegalArgumentException 인자가 null이거나 handle이 owner 자신인 경우
     */
    <H> FinalizerBinding register(Object owner, H handle, Consumer<? super H> release);

    /**
     * 아직 실행도 취소도 되지 않은 등록 수.
     *
     * @return 대기 중인 등록 수
     */
    int pendingCount();
}
