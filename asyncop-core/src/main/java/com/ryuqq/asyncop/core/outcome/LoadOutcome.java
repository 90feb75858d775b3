package com.ryuqq.asyncop.core.outcome;

/**
 * Guarded load 한 번의 결과.
 *
 * <p>LoadOutcome은 다섯 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Loaded}: 데이터를 가져와 컬렉션에 반영함</li>
 *   <li>{@link Skipped}: 이미 load가 진행 중이어서 아무 것도 하지 않음 (중복 요청)</li>
 *   <li>{@link TimedOut}: 조회가 제한 시간 안에 끝나지 않음 (성공도 실패도 아님)</li>
 *   <li>{@link Cancelled}: 취소됨</li>
 *   <li>{@link Failed}: 재시도 소진 등 terminal failure</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스가 컴파일 타임에 고정됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface LoadOutcome permits Loaded, Skipped, TimedOut, Cancelled, Failed {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isLoaded() {
        return this instanceof Loaded;
    }

    /**
     * 중복 요청으로 건너뛰었는지 확인.
     *
     * @return 건너뛴 경우 true
     */
    default boolean isSkipped() {
        return this instanceof Skipped;
    }

    /**
     * 제한 시간 초과인지 확인.
     *
     * @return 시간 초과 여부
     */
    default boolean isTimedOut() {
        return this instanceof TimedOut;
    }

    /**
     * 취소되었는지 확인.
     *
     * @return 취소 여부
     */
    default boolean isCancelled() {
        return this instanceof Cancelled;
    }

    /**
     * 실패했는지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailed() {
        return this instanceof Failed;
    }
}
