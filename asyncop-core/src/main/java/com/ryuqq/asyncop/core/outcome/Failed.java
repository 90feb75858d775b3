package com.ryuqq.asyncop.core.outcome;

/**
 * Terminal Failure.
 *
 * @param cause 실패 원인
 * @param fallbackApplied 실패 후 대체 데이터로 컬렉션을 교체했는지 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Failed(Throwable cause, boolean fallbackApplied) implements LoadOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public Failed {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
    }
}
