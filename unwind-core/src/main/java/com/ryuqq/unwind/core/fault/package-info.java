/**
 * Fault model package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.unwind.core.fault.Fault} - Payload, origin, unwind path and superseded chain</li>
 *   <li>{@link com.ryuqq.unwind.core.fault.FatalFaultReport} - Report for a fault no context recovered</li>
 *   <li>{@link com.ryuqq.unwind.core.fault.FatalFaultError} - Error thrown from the outermost context</li>
 * </ul>
 *
 * <p>A fault raised inside a deferred action during an unwind supersedes the active one.
 * The superseded fault stays linked and is always part of the fatal report.</p>
 *
 * @since 1.0.0
 * @author Unwind Team
 */
package com.ryuqq.unwind.core.fault;
