package com.ryuqq.unwind.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InvokerConfig Record 테스트.
 *
 * @author Unwind Team
 * @since 1.0.0
 */
class InvokerConfigTest {

    @Test
    void defaultConstructor_DefaultValues() {
        // When
        InvokerConfig config = new InvokerConfig();

        // Then
        assertEquals(1024, config.maxDepth());
        assertTrue(config.logRecoveredAttempts());
    }

    @Test
    void withMaxDepth_KeepsOtherField() {
        // When
        InvokerConfig config = new InvokerConfig().withLogRecoveredAttempts(false).withMaxDepth(64);

        // Then
        assertEquals(64, config.maxDepth());
        assertFalse(config.logRecoveredAttempts());
    }

    @Test
    void constructor_NonPositiveMaxDepth_ThrowsException() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> new InvokerConfig(0, true));
        assertTrue(exception.getMessage().contains("maxDepth must be positive"));
    }
}
