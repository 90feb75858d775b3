/**
 * Error taxonomy of the async operation core.
 *
 * <ul>
 *   <li>{@link com.ryuqq.asyncop.core.error.OperationCancelledException} - caller or epoch-reset cancellation, never retried</li>
 *   <li>{@link com.ryuqq.asyncop.core.error.RetryExhaustedException} - terminal failure after the last attempt</li>
 *   <li>{@link com.ryuqq.asyncop.core.error.OperationFailedException} - checked failure wrapped for propagation</li>
 * </ul>
 *
 * <p>Duplicate requests and timeout races are reported as
 * {@link com.ryuqq.asyncop.core.outcome.LoadOutcome} values, not exceptions.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.asyncop.core.error;
