/**
 * Service Provider Interfaces consumed by the orchestration core.
 *
 * <ul>
 *   <li>{@link com.ryuqq.asyncop.core.spi.DispatcherBridge} - marshaling onto the UI-confined execution context</li>
 *   <li>{@link com.ryuqq.asyncop.core.spi.Repository} - fetches domain records, may fail transiently</li>
 *   <li>{@link com.ryuqq.asyncop.core.spi.ErrorReporter} - caller-level user notification of terminal failures</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.asyncop.core.spi;
