/**
 * In-memory Repository adapter implementation package.
 *
 * <p>This package provides a reference implementation of the
 * {@link com.ryuqq.asyncop.core.spi.Repository} SPI for testing and educational purposes.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.asyncop.adapter.inmemory.repository.InMemoryRepository}:
 *       Thread-safe record store with optional simulated fetch latency</li>
 * </ul>
 *
 * @see com.ryuqq.asyncop.core.spi.Repository
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.asyncop.adapter.inmemory.repository;
