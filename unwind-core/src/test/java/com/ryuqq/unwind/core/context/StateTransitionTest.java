package com.ryuqq.unwind.core.context;

import org.junit.jupiter.api.Test;

import static com.ryuqq.unwind.core.context.ContextState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * <ul>
 *   <li>NORMAL → UNWINDING → RECOVERED → NORMAL 복구 흐름</li>
 *   <li>UNWINDING → UNWINDING (fault 대체)</li>
 *   <li>UNWINDING → FATAL (root 종료)</li>
 *   <li>FATAL에서의 모든 전이 거부</li>
 * </ul>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void transition_RecoveryFlow_ReturnsToNormal() {
        // Given
        ContextState state = NORMAL;

        // When
        state = StateTransition.transition(state, UNWINDING);
        state = StateTransition.transition(state, RECOVERED);
        state = StateTransition.transition(state, NORMAL);

        // Then
        assertEquals(NORMAL, state);
        assertFalse(state.isTerminal());
    }

    @Test
    void validate_UnwindingToUnwinding_SucceedsForSupersede() {
        // When & Then
        assertDoesNotThrow(() -> StateTransition.validate(UNWINDING, UNWINDING));
    }

    @Test
    void validate_RecoveredToUnwinding_SucceedsForLaterFault() {
        // When & Then
        assertDoesNotThrow(() -> StateTransition.validate(RECOVERED, UNWINDING));
    }

    @Test
    void transition_UnwindingToFatal_IsTerminal() {
        // When
        ContextState state = StateTransition.transition(UNWINDING, FATAL);

        // Then
        assertTrue(state.isTerminal());
    }

    // ========== 불법 전이 테스트 ==========

    @Test
    void validate_FatalToAnything_ThrowsException() {
        for (ContextState target : ContextState.values()) {
            IllegalStateException exception = assertThrows(
                IllegalStateException.class,
                () -> StateTransition.validate(FATAL, target)
            );
            assertTrue(exception.getMessage().contains("terminal state"));
        }
    }

    @Test
    void validate_NormalToRecovered_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(NORMAL, RECOVERED)
        );
        assertTrue(exception.getMessage().contains("NORMAL"));
        assertTrue(exception.getMessage().contains("RECOVERED"));
    }

    @Test
    void validate_NormalToFatal_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(NORMAL, FATAL));
    }

    @Test
    void validate_RecoveredToFatal_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(RECOVERED, FATAL));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(null, NORMAL));
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(NORMAL, null));
    }
}
