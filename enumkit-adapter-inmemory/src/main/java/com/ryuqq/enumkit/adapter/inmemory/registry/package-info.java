/**
 * In-memory EnumRegistry adapter implementation package.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.enumkit.adapter.inmemory.registry.InMemoryEnumRegistry}:
 *       Thread-safe write-once implementation of {@link com.ryuqq.enumkit.core.spi.EnumRegistry}</li>
 * </ul>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Concurrency:</strong> Uses {@link java.util.concurrent.ConcurrentHashMap}
 *       for atomic check-then-insert</li>
 *   <li><strong>Snapshots:</strong> Listing returns an independent sorted copy</li>
 * </ul>
 *
 * @see com.ryuqq.enumkit.core.spi.EnumRegistry
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.enumkit.adapter.inmemory.registry;
