package com.ryuqq.asyncop.core.outcome;

/**
 * 제한 시간 초과.
 *
 * <p>호출자가 구성한 "작업 vs 고정 지연" 경쟁에서 지연이 먼저 끝난 경우입니다.
 * UI는 일반적인 성공/실패와 구분되는 "시간 초과" 메시지를 표시해야 합니다.</p>
 *
 * @param timeoutMs 적용된 제한 시간 (밀리초, 양수)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TimedOut(long timeoutMs) implements LoadOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException timeoutMs가 양수가 아닌 경우
     */
    public TimedOut {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive (current: " + timeoutMs + ")");
        }
    }
}
