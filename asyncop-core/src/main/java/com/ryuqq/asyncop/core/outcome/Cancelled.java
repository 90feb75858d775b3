package com.ryuqq.asyncop.core.outcome;

/**
 * 취소됨.
 *
 * @param reason 취소 사유 (null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Cancelled(String reason) implements LoadOutcome {
}
