package com.ryuqq.unwind.application.invoker;

import com.ryuqq.unwind.core.context.Body;
import com.ryuqq.unwind.core.error.Result;

/**
 * Root invocation entry point.
 *
 * <p>This interface opens a root {@link com.ryuqq.unwind.core.context.InvocationContext} on the
 * calling thread, runs the body, drains the deferred stack and applies the fault policy.</p>
 *
 * <p><strong>Execution Flow:</strong></p>
 * <pre>
 * run(name, body)
 *   ↓
 * open root context (depth 1, owner = current thread)
 *   ↓
 * body.apply(root)  → nested call(...) contexts
 *   ↓
 * drain deferred stack (LIFO)
 *   ↓
 * ├─ NORMAL / RECOVERED → return value
 * └─ UNWINDING          → FatalFaultHandler.onFatal(report) → throw FatalFaultError
 * </pre>
 *
 * <p><strong>Threading:</strong></p>
 * <ul>
 *   <li>Every call opens an independent chain confined to the calling thread.</li>
 *   <li>Implementations are stateless across calls and safe to share between threads.</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Invoker invoker = new ThreadConfinedInvoker(new InvokerConfig());
 *
 * Report report = invoker.run("nightly-report", ctx -&gt; {
 *     DeferredResources.lock(ctx, reportLock);
 *     return ctx.call("render", render -&gt; renderer.render(render));
 * });
 *
 * Result&lt;Report&gt; guarded = invoker.attempt("nightly-report", ctx -&gt; build(ctx));
 * </pre>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public interface Invoker {

    /**
     * Runs the body in a new root context.
     *
     * @param name root context name
     * @param body body to run
     * @param <T> return type
     * @return the body's value, or the value a deferred action set after recovery
     * @throws IllegalArgumentException if name is blank or body is null
     * @throws com.ryuqq.unwind.core.fault.FatalFaultError if a fault leaves the root unrecovered
     */
    <T> T run(String name, Body<T> body);

    /**
     * Runs the body in a new root context and converts an unrecovered fault into an {@code Err}.
     *
     * <p>The fault handler is not invoked for faults converted this way.</p>
     *
     * @param name root context name
     * @param body body to run
     * @param <T> value type
     * @return {@code Ok(value)} or {@code Err(RecoveredFault)}
     * @throws IllegalArgumentException if name is blank or body is null
     */
    <T> Result<T> attempt(String name, Body<T> body);
}
