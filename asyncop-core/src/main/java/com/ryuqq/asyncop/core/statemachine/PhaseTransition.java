package com.ryuqq.asyncop.core.statemachine;

/**
 * Operation 단계 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>IDLE → LOADING</li>
 *   <li>LOADING → SUCCEEDED / CANCELLED / FAILED</li>
 *   <li>SUCCEEDED / CANCELLED / FAILED → IDLE (cleanup)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PhaseTransition {

    // Utility class - prevent instantiation
    private PhaseTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단계 전이가 유효한지 검증.
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(OperationPhase from, OperationPhase to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Phases cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid = switch (from) {
            case IDLE -> to == OperationPhase.LOADING;
            case LOADING -> to.isTerminal();
            case SUCCEEDED, CANCELLED, FAILED -> to == OperationPhase.IDLE; // cleanup
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid phase transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 단계 전이 실행 (검증 후).
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @return 전이된 단계 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static OperationPhase transition(OperationPhase current, OperationPhase next) {
        validate(current, next);
        return next;
    }
}
