/**
 * Finalizer registry package.
 *
 * <p>Cleanup tied to reachability rather than lexical scope. A fallback for resources with
 * diffuse ownership; never the primary release path for scoped resources.</p>
 *
 * <p>No ordering between finalizers and no specific thread is guaranteed.</p>
 *
 * @since 1.0.0
 * @author Unwind Team
 */
package com.ryuqq.unwind.core.finalizer;
