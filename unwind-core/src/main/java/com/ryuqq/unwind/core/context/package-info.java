/**
 * Invocation context package.
 *
 * <p>This package defines the call-frame abstraction that owns a deferred stack and
 * carries faults outward through the chain of enclosing contexts.</p>
 *
 * <h2>Main Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.unwind.core.context.InvocationContext} - Call frame: defer, raise, recover, call</li>
 *   <li>{@link com.ryuqq.unwind.core.context.ContextState} - NORMAL, UNWINDING, RECOVERED, FATAL</li>
 *   <li>{@link com.ryuqq.unwind.core.context.StateTransition} - Transition validation</li>
 *   <li>{@link com.ryuqq.unwind.core.context.ContextOptions} - Chain-wide options (depth limit, fatal handler)</li>
 *   <li>{@link com.ryuqq.unwind.core.context.FaultSignal} - Internal carrier thrown while unwinding</li>
 * </ul>
 *
 * <h2>State Machine</h2>
 * <pre>
 * NORMAL → UNWINDING(payload) → { FATAL | RECOVERED → NORMAL }
 * </pre>
 *
 * <h2>Threading</h2>
 * <p>A context is confined to the thread that created it. Concurrent threads each hold
 * an independent chain; a fault in one chain never reaches another.</p>
 *
 * @since 1.0.0
 * @author Unwind Team
 */
package com.ryuqq.unwind.core.context;
