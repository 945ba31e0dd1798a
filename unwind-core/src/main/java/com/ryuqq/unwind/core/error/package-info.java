/**
 * Error value protocol package.
 *
 * <p>Expected, recoverable failures travel as ordinary return values. Nothing in this
 * package affects control flow; callers check and propagate by hand.</p>
 *
 * <h2>Sealed Result</h2>
 * <ul>
 *   <li>{@link com.ryuqq.unwind.core.error.Result} - Sealed interface (permits Ok, Err)</li>
 *   <li>{@link com.ryuqq.unwind.core.error.Ok} - Value</li>
 *   <li>{@link com.ryuqq.unwind.core.error.Err} - {@link com.ryuqq.unwind.core.error.ErrorValue}</li>
 * </ul>
 *
 * <h2>Error Kinds</h2>
 * <ul>
 *   <li>{@link com.ryuqq.unwind.core.error.SimpleError} - Description only, usable as a sentinel</li>
 *   <li>{@link com.ryuqq.unwind.core.error.WrappedError} - Adds context, keeps the cause chain</li>
 *   <li>{@link com.ryuqq.unwind.core.error.ThrowableError} - Java exception returned as a value</li>
 *   <li>{@link com.ryuqq.unwind.core.error.RecoveredFault} - Fault converted into an expected error</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Unwind Team
 */
package com.ryuqq.unwind.core.error;
