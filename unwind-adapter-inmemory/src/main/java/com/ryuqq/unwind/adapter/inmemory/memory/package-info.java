/**
 * In-memory MemoryManager adapter implementation package.
 *
 * <p>This package provides a deterministic reference implementation of the
 * {@link com.ryuqq.unwind.core.spi.MemoryManager} SPI for testing finalizer behavior
 * without depending on the garbage collector.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.unwind.adapter.inmemory.memory.InMemoryMemoryManager}:
 *       Test-controlled reachability with explicit sweep</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Tracked objects are never garbage collected while registered</li>
 *   <li>Not suitable for production use</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.unwind.core.spi.MemoryManager
 * @author Unwind Team
 * @since 1.0.0
 */
package com.ryuqq.unwind.adapter.inmemory.memory;
