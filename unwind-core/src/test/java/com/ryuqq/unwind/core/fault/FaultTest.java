package com.ryuqq.unwind.core.fault;

import com.ryuqq.unwind.core.error.SimpleError;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Fault Record 테스트.
 *
 * @author Unwind Team
 * @since 1.0.0
 */
class FaultTest {

    @Test
    void passedThrough_AppendsOutward_AndKeepsOriginal() {
        // Given
        Fault raised = Fault.raised("boom", "open");

        // When
        Fault propagated = raised.passedThrough("open").passedThrough("load");

        // Then
        assertEquals(List.of("open", "load"), propagated.unwindPath());
        assertTrue(raised.unwindPath().isEmpty());
        assertEquals("open", propagated.origin());
    }

    @Test
    void supersede_ChainIsNewestFirst() {
        // Given
        Fault first = Fault.raised("first", "main");
        Fault second = Fault.raised("second", "main").supersede(first);

        // When
        Fault third = Fault.raised("third", "main").supersede(second);

        // Then
        assertTrue(third.isSuperseding());
        assertEquals(List.of("second", "first"),
            third.supersededChain().stream().map(Fault::payload).toList());
    }

    @Test
    void supersede_ExistingChain_PreviousAppendedAtTail() {
        // Given
        Fault older = Fault.raised("older", "main");
        Fault withChain = Fault.raised("newest", "main").supersede(Fault.raised("middle", "main"));

        // When
        Fault combined = withChain.supersede(older);

        // Then
        assertEquals(List.of("middle", "older"),
            combined.supersededChain().stream().map(Fault::payload).toList());
    }

    @Test
    void payloadAs_TypeMatch_ReturnsPayload() {
        // Given
        Fault fault = Fault.raised(new SimpleError("missing"), "load");

        // When & Then
        assertEquals("missing", fault.payloadAs(SimpleError.class).orElseThrow().description());
        assertTrue(fault.payloadAs(Throwable.class).isEmpty());
        assertTrue(Fault.raised(null, "load").payloadAs(Object.class).isEmpty());
    }

    @Test
    void describe_ByPayloadKind() {
        assertEquals("missing", Fault.raised(new SimpleError("missing"), "x").describe());
        assertEquals("java.lang.IllegalStateException: bad",
            Fault.raised(new IllegalStateException("bad"), "x").describe());
        assertEquals("java.lang.IllegalStateException",
            Fault.raised(new IllegalStateException(), "x").describe());
        assertEquals("42", Fault.raised(42, "x").describe());
        assertEquals("null", Fault.raised(null, "x").describe());
    }

    @Test
    void constructor_UnwindPathCopied() {
        // Given
        List<String> path = new ArrayList<>(List.of("a"));

        // When
        Fault fault = new Fault("p", "a", path, null);
        path.add("b");

        // Then
        assertEquals(List.of("a"), fault.unwindPath());
    }

    @Test
    void constructor_BlankOrigin_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Fault.raised("p", " "));
        assertThrows(IllegalArgumentException.class, () -> new Fault("p", "a", null, null));
        assertThrows(IllegalArgumentException.class, () -> Fault.raised("p", "a").supersede(null));
    }
}
