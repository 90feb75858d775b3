/**
 * Progress reporting for long-running operations.
 *
 * <ul>
 *   <li>{@link com.ryuqq.asyncop.core.progress.MonotonicProgressReporter} - clamped, non-decreasing percentage with elapsed time</li>
 *   <li>{@link com.ryuqq.asyncop.core.progress.StepProgressTracker} - named steps with per-step completed/inProgress flags</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.asyncop.core.progress;
