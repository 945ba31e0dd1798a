/**
 * Deferred call stack package.
 *
 * <p>Scheduled cleanup actions run in reverse registration order when their context exits,
 * on every exit path: normal return, early return or fault unwind.</p>
 *
 * <h2>Argument Capture</h2>
 * <ul>
 *   <li>Arguments passed to {@code defer(action, arg)} are frozen at registration time.</li>
 *   <li>Variables read inside a closure are observed when the action runs.</li>
 * </ul>
 *
 * <h2>Lock Idiom</h2>
 * <pre>
 * DeferredResources.lock(ctx, lock);   // acquire, then unlock is scheduled immediately
 * mutate(sharedMap);                    // a fault here still releases the lock
 * </pre>
 *
 * @since 1.0.0
 * @author Unwind Team
 */
package com.ryuqq.unwind.core.defer;
