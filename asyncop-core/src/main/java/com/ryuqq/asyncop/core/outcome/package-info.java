/**
 * Results of a guarded load.
 *
 * <pre>
 * LoadOutcome
 *  ├─ Loaded    (itemCount, fallbackApplied)
 *  ├─ Skipped   (another load in flight)
 *  ├─ TimedOut  (timeoutMs)
 *  ├─ Cancelled (reason)
 *  └─ Failed    (cause, fallbackApplied)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.asyncop.core.outcome;
