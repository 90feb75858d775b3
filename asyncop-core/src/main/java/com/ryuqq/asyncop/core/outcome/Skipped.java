package com.ryuqq.asyncop.core.outcome;

/**
 * 중복 요청으로 건너뜀.
 *
 * <p>예외가 아니라 조용한 no-op입니다. 어떤 상태도 변경되지 않습니다.</p>
 *
 * @param reason 건너뛴 사유
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Skipped(String reason) implements LoadOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException reason이 null 또는 blank인 경우
     */
    public Skipped {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }
}
