package com.ryuqq.asyncop.core.outcome;

/**
 * Load 성공.
 *
 * @param itemCount 컬렉션에 반영된 항목 수 (0 이상)
 * @param fallbackApplied 조회 결과가 비어 있어 대체 데이터를 추가했는지 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Loaded(int itemCount, boolean fallbackApplied) implements LoadOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException itemCount가 음수인 경우
     */
    public Loaded {
        if (itemCount < 0) {
            throw new IllegalArgumentException("itemCount must be non-negative (current: " + itemCount + ")");
        }
    }
}
