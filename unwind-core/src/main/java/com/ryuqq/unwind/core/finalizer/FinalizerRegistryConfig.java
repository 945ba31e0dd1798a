package com.ryuqq.unwind.core.finalizer;

/**
 * FinalizerRegistry 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>rethrowOnExplicitClean: {@link FinalizerBinding#clean()}으로 실행한 cleanup의 예외를 호출자에게 전파 (기본 true)</li>
 *   <li>pendingWarnThreshold: 대기 중인 등록 수가 이 값을 넘으면 경고 로그 (기본 10000)</li>
 * </ul>
 *
 * <p>메모리 관리자가 호출한 cleanup의 예외는 설정과 무관하게 항상 로그로만 남습니다.</p>
 *
 * @author Unwind Team
 * @since 1.0.0
 * @param rethrowOnExplicitClean 명시적 clean 실패 전파 여부
 * @param pendingWarnThreshold 경고 임계값 (1 이상)
 */
public record FinalizerRegistryConfig(boolean rethrowOnExplicitClean, int pendingWarnThreshold) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: rethrowOnExplicitClean=true, pendingWarnThreshold=10000</p>
     */
    public FinalizerRegistryConfig() {
        this(true, 10_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public FinalizerRegistryConfig {
        if (pendingWarnThreshold <= 0) {
            throw new IllegalArgumentException(
                "pendingWarnThreshold must be positive (current: " + pendingWarnThreshold + ")"
            );
        }
    }

    /**
     * rethrowOnExplicitClean만 변경한 새 인스턴스 생성.
     *
     * @param rethrowOnExplicitClean 새 값
     * @return 새 FinalizerRegistryConfig 인스턴스
     */
    public FinalizerRegistryConfig withRethrowOnExplicitClean(boolean rethrowOnExplicitClean) {
        return new FinalizerRegistryConfig(rethrowOnExplicitClean, this.pendingWarnThreshold);
    }

    /**
     * pendingWarnThreshold만 변경한 새 인스턴스 생성.
     *
     * @param pendingWarnThreshold 새 임계값
     * @return 새 FinalizerRegistryConfig 인스턴스
     */
    public FinalizerRegistryConfig withPendingWarnThreshold(int pendingWarnThreshold) {
        return new FinalizerRegistryConfig(this.rethrowOnExplicitClean, pendingWarnThreshold);
    }
}
