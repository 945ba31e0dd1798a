package com.ryuqq.unwind.core.context;

/**
 * ContextState 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>NORMAL → UNWINDING</li>
 *   <li>UNWINDING → UNWINDING, RECOVERED, FATAL</li>
 *   <li>RECOVERED → UNWINDING, NORMAL</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>FATAL에서는 어떤 상태로도 전이 불가</li>
 *   <li>fault 없이 RECOVERED 또는 FATAL로 진입 불가</li>
 * </ul>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public final class StateTransition {

    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(ContextState from, ContextState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case NORMAL -> to == ContextState.UNWINDING;
            case UNWINDING -> to == ContextState.UNWINDING
                || to == ContextState.RECOVERED
                || to == ContextState.FATAL;
            case RECOVERED -> to == ContextState.UNWINDING || to == ContextState.NORMAL;
            case FATAL -> false; // 위에서 이미 차단
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static ContextState transition(ContextState current, ContextState next) {
        validate(current, next);
        return next;
    }
}
