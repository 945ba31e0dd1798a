package com.ryuqq.unwind.testkit.contract;

import com.ryuqq.unwind.core.defer.DeferredEntry;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for argument capture semantics.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Arguments passed to defer are fixed at registration time</li>
 *   <li>Closures observe values current at execution time</li>
 *   <li>Captured arguments are visible on the deferred entry</li>
 * </ul>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
class ArgumentCaptureContractTest extends AbstractContractTest {

    @Test
    void testCapture_ArgumentFixedAtRegistration_ClosureSeesLatestValue() {
        // Given
        AtomicInteger counter = new AtomicInteger(1);

        // When
        invoker.run("main", ctx -> {
            ctx.defer(v -> record("value=" + v), counter.get());
            ctx.defer(() -> record("closure=" + counter.get()));
            counter.set(2);
            return null;
        });

        // Then
        assertTrace("closure=2", "value=1");
    }

    @Test
    void testCapture_TwoArguments_BothFixedAtRegistration() {
        // Given
        AtomicReference<String> label = new AtomicReference<>("before");

        // When
        invoker.run("main", ctx -> {
            ctx.defer((l, n) -> record(l + "#" + n), label.get(), 7);
            label.set("after");
            return null;
        });

        // Then
        assertTrace("before#7");
    }

    @Test
    void testCapture_EntryExposesCapturedArguments() {
        // When
        List<DeferredEntry> entries = invoker.run("main", ctx -> {
            DeferredEntry single = ctx.defer(this::record, "x");
            DeferredEntry pair = ctx.defer((a, b) -> record(a + "" + b), "y", null);
            DeferredEntry closure = ctx.defer(() -> record("z"));
            return List.of(single, pair, closure);
        });

        // Then
        assertEquals(List.of("x"), entries.get(0).capturedArgs());
        assertEquals(Arrays.asList("y", null), entries.get(1).capturedArgs());
        assertTrue(entries.get(2).capturedArgs().isEmpty());
        assertTrace("z", "ynull", "x");
    }

    @Test
    void testCapture_EntriesNumberedInRegistrationOrder() {
        // When
        List<DeferredEntry> entries = invoker.run("main", ctx -> List.of(
            ctx.defer(() -> record("first")),
            ctx.defer("named action", () -> record("second"))
        ));

        // Then
        assertTrue(entries.get(0).sequence() < entries.get(1).sequence());
        assertEquals("named action", entries.get(1).description());
        assertTrace("second", "first");
    }
}
