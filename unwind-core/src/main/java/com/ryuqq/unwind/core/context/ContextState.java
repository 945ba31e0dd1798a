package com.ryuqq.unwind.core.context;

/**
 * InvocationContext의 실행 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>NORMAL → UNWINDING (fault 발생)</li>
 *   <li>UNWINDING → UNWINDING (unwind 중 새 fault가 기존 fault를 대체)</li>
 *   <li>UNWINDING → RECOVERED (deferred action에서 recover 호출)</li>
 *   <li>UNWINDING → FATAL (최외곽 context까지 복구되지 않음)</li>
 *   <li>RECOVERED → UNWINDING (복구 이후 남은 deferred action이 다시 fault 발생)</li>
 *   <li>RECOVERED → NORMAL (context 종료 시점, 호출자는 정상 반환을 관찰)</li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * NORMAL
 *    │
 *    ▼ (raise)
 * UNWINDING ◄──────────┐
 *    │                 │ (raise in deferred)
 *    ├─► RECOVERED ────┘
 *    │       │
 *    │       ▼ (exit)
 *    │    NORMAL
 *    │
 *    └─► FATAL (최외곽, 프로세스/스레드 종료)
 *
 * 금지된 전이:
 * - FATAL → * ❌
 * - NORMAL → RECOVERED ❌
 * - NORMAL → FATAL ❌
 * </pre>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public enum ContextState {

    /**
     * 정상 실행 중 (활성 fault 없음).
     */
    NORMAL,

    /**
     * fault가 활성화되어 deferred stack을 비우며 바깥으로 전파 중.
     */
    UNWINDING,

    /**
     * deferred action이 fault를 회수함 (context 종료 시 NORMAL로 복귀).
     */
    RECOVERED,

    /**
     * 어떤 context에서도 복구되지 않은 fault (종료 상태).
     */
    FATAL;

    /**
     * 종료 상태인지 확인.
     *
     * @return FATAL인 경우 true
     */
    public boolean isTerminal() {
        return this == FATAL;
    }

    /**
     * 활성 fault가 존재하는 상태인지 확인.
     *
     * @return UNWINDING인 경우 true
     */
    public boolean isUnwinding() {
        return this == UNWINDING;
    }
}
