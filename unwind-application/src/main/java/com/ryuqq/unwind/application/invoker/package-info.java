/**
 * Invocation entry point package.
 *
 * <p>This package defines the {@link com.ryuqq.unwind.application.invoker.Invoker} contract
 * that application code uses to open root contexts.</p>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@code ThreadConfinedInvoker} (unwind-adapter-runner) - Per-thread root chains</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Unwind Team
 */
package com.ryuqq.unwind.application.invoker;
