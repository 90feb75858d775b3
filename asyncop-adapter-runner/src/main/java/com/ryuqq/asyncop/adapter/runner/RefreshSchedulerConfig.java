package com.ryuqq.asyncop.adapter.runner;

/**
 * PeriodicRefreshScheduler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>initialDelayMs: 첫 refresh까지의 대기 시간 (기본 300000ms = 5분)</li>
 *   <li>intervalMs: 이전 refresh 종료 후 다음 refresh까지의 간격 (기본 300000ms = 5분)</li>
 *   <li>shutdownTimeoutMs: stop() 시 진행 중인 refresh를 기다리는 최대 시간 (기본 60000ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param initialDelayMs 첫 실행 지연 (밀리초, 0 이상)
 * @param intervalMs 실행 간격 (밀리초, 양수)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수)
 */
public record RefreshSchedulerConfig(
    long initialDelayMs,
    long intervalMs,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: initialDelayMs=300000ms, intervalMs=300000ms, shutdownTimeoutMs=60000ms</p>
     */
    public RefreshSchedulerConfig() {
        this(300000, 300000, 60000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RefreshSchedulerConfig {
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException(
                "initialDelayMs must be non-negative (current: " + initialDelayMs + ")"
            );
        }
        if (intervalMs <= 0) {
            throw new IllegalArgumentException(
                "intervalMs must be positive (current: " + intervalMs + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * initialDelayMs만 변경한 새 인스턴스 생성.
     */
    public RefreshSchedulerConfig withInitialDelayMs(long initialDelayMs) {
        return new RefreshSchedulerConfig(initialDelayMs, intervalMs, shutdownTimeoutMs);
    }

    /**
     * intervalMs만 변경한 새 인스턴스 생성.
     */
    public RefreshSchedulerConfig withIntervalMs(long intervalMs) {
        return new RefreshSchedulerConfig(initialDelayMs, intervalMs, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public RefreshSchedulerConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new RefreshSchedulerConfig(initialDelayMs, intervalMs, shutdownTimeoutMs);
    }
}
