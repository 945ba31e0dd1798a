package com.ryuqq.unwind.core.finalizer;

/**
 * finalizer 등록 핸들.
 *
 * <p>cleanup 작업은 이 핸들과 메모리 관리자가 보관하며, 추적 대상 객체는 이를 알지 못합니다.</p>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public interface FinalizerBinding {

    /**
     * 진단용 라벨 (추적 대상 객체의 클래스 이름).
     *
     * @return 라벨
     */
    String label();

    /**
     * cleanup을 지금 호출 스레드에서 실행 (아직 실행되지 않은 경우에만).
     *
     * @return 이번 호출로 실행되었으면 true
     */
    boolean clean();

    /**
     * cleanup을 실행하지 않고 등록 해제.
     *
     * @return 이번 호출로 취소되었으면 true
     */
    boolean cancel();

    /**
     * 아직 실행도 취소도 되지 않았는지 확인.
     *
     * @return 대기 중이면 true
     */
    boolean isPending();
}
