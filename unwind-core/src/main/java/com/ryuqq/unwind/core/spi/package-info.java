/**
 * Service Provider Interfaces for external collaborators.
 *
 * <ul>
 *   <li>{@link com.ryuqq.unwind.core.spi.MemoryManager} - Reachability-based callbacks</li>
 *   <li>{@link com.ryuqq.unwind.core.spi.FatalFaultHandler} - Reporting or termination on fatal faults</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Unwind Team
 */
package com.ryuqq.unwind.core.spi;
