/**
 * Runner adapter implementation package.
 *
 * <p>This package provides the production implementations of the application and core SPIs.</p>
 *
 * <h2>Main Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.unwind.adapter.runner.ThreadConfinedInvoker} - Opens root contexts on the calling thread</li>
 *   <li>{@link com.ryuqq.unwind.adapter.runner.InvokerConfig} - Depth limit and attempt logging</li>
 *   <li>{@link com.ryuqq.unwind.adapter.runner.LoggingFatalFaultHandler} - Logs fatal reports via SLF4J</li>
 *   <li>{@link com.ryuqq.unwind.adapter.runner.TerminatingFatalFaultHandler} - Logs, then exits the process</li>
 *   <li>{@link com.ryuqq.unwind.adapter.runner.CleanerMemoryManager} - {@link java.lang.ref.Cleaner} backed memory manager</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Unwind Team
 */
package com.ryuqq.unwind.adapter.runner;
