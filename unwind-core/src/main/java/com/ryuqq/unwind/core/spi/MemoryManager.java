package com.ryuqq.unwind.core.spi;

/**
 * 도달 가능성(reachability) 기반 정리를 제공하는 외부 메모리 관리자 SPI.
 *
 * <p>referent가 더 이상 도달 불가능해지면 callback을 호출합니다.
 * 구현체 예: {@code java.lang.ref.Cleaner} 기반 어댑터, 테스트용 in-memory 구현.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>callback은 임의의 스레드에서, 다른 callback과 순서 보장 없이 호출될 수 있습니다.</li>
 *   <li>callback은 referent를 참조해서는 안 됩니다 (참조하면 referent가 영원히 도달 가능).</li>
 *   <li>callback은 최대 한 번 호출됩니다 ({@link Registration#clean()} 포함).</li>
 * </ul>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public interface MemoryManager {

    /**
     * referent의 도달 가능성 추적 시작.
     *
     * @param referent 추적할 객체
     * @param onUnreachable 도달 불가능해졌을 때 호출할 작업
     * @return 등록 핸들
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    Registration track(Object referent, Runnable onUnreachable);

    /**
     * 추적 등록 핸들.
     */
    interface Registration {

        /**
         * 추적을 해제하고, callback이 아직 실행되지 않았다면 지금 호출 스레드에서 실행.
         */
        void clean();
    }
}
