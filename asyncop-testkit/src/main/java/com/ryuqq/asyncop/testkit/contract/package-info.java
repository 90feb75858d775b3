/**
 * Contract test infrastructure for the orchestration layer.
 *
 * <p>Contract tests run the loader, executor, tracker and collection together on a real
 * UI event loop and worker pool.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.asyncop.testkit.contract;
