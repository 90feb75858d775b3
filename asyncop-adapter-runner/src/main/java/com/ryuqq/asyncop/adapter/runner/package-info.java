/**
 * Runtime adapters: dispatcher implementations and the timer-driven refresh.
 *
 * <ul>
 *   <li>{@link com.ryuqq.asyncop.adapter.runner.EventLoopDispatcher} - one dedicated thread as the UI-confined context</li>
 *   <li>{@link com.ryuqq.asyncop.adapter.runner.ImmediateDispatcher} - synchronous pass-through for headless use</li>
 *   <li>{@link com.ryuqq.asyncop.adapter.runner.PeriodicRefreshScheduler} - fixed-delay reload of a collection</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.asyncop.adapter.runner;
