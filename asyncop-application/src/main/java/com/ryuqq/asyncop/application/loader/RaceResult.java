package com.ryuqq.asyncop.application.loader;

/**
 * {@link TimeoutRace} 결과.
 *
 * @param value 완료된 경우 결과 값 (시간 초과 시 null)
 * @param timedOut 시간 초과 여부
 * @param timeoutMs 경주에 사용한 제한 시간
 * @param <T> 결과 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RaceResult<T>(T value, boolean timedOut, long timeoutMs) {

    public static <T> RaceResult<T> completed(T value, long timeoutMs) {
        return new RaceResult<>(value, false, timeoutMs);
    }

    public static <T> RaceResult<T> timedOut(long timeoutMs) {
        return new RaceResult<>(null, true, timeoutMs);
    }
}
