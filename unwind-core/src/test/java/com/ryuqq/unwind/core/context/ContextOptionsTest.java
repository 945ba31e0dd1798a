package com.ryuqq.unwind.core.context;

import com.ryuqq.unwind.core.spi.noop.NoOpFatalFaultHandler;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ContextOptions 테스트.
 *
 * @author Unwind Team
 * @since 1.0.0
 */
class ContextOptionsTest {

    @Test
    void defaultConstructor_UsesDefaultDepthAndNoOpHandler() {
        // When
        ContextOptions options = new ContextOptions();

        // Then
        assertEquals(ContextOptions.DEFAULT_MAX_DEPTH, options.maxDepth());
        assertSame(NoOpFatalFaultHandler.INSTANCE, options.fatalFaultHandler());
    }

    @Test
    void constructor_NonPositiveDepth_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new ContextOptions(0, NoOpFatalFaultHandler.INSTANCE)
        );
        assertTrue(exception.getMessage().contains("maxDepth"));
    }

    @Test
    void constructor_NullHandler_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new ContextOptions(8, null));
    }
}
