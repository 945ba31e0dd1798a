package com.ryuqq.unwind.adapter.runner;

/**
 * Invoker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxDepth: 허용되는 최대 context 중첩 깊이 (기본 1024, root = 1)</li>
 *   <li>logRecoveredAttempts: attempt가 fault를 Err로 변환할 때 경고 로그 (기본 true)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>깊은 재귀 처리: maxDepth 증가 (스레드 stack 크기도 함께 고려)</li>
 *   <li>잦은 예상 실패를 attempt로 처리: logRecoveredAttempts=false</li>
 * </ul>
 *
 * @author Unwind Team
 * @since 1.0.0
 * @param maxDepth 최대 중첩 깊이 (1 이상이어야 함)
 * @param logRecoveredAttempts attempt 복구 로그 여부
 */
public record InvokerConfig(int maxDepth, boolean logRecoveredAttempts) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxDepth=1024, logRecoveredAttempts=true</p>
     */
    public InvokerConfig() {
        this(1024, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public InvokerConfig {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException(
                "maxDepth must be positive (current: " + maxDepth + ")"
            );
        }
    }

    /**
     * maxDepth만 변경한 새 인스턴스 생성.
     *
     * @param maxDepth 새 최대 깊이
     * @return 새 InvokerConfig 인스턴스
     */
    public InvokerConfig withMaxDepth(int maxDepth) {
        return new InvokerConfig(maxDepth, this.logRecoveredAttempts);
    }

    /**
     * logRecoveredAttempts만 변경한 새 인스턴스 생성.
     *
     * @param logRecoveredAttempts 새 값
     * @return 새 InvokerConfig 인스턴스
     */
    public InvokerConfig withLogRecoveredAttempts(boolean logRecoveredAttempts) {
        return new InvokerConfig(this.maxDepth, logRecoveredAttempts);
    }
}
