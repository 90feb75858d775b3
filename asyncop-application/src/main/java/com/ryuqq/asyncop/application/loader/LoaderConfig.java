package com.ryuqq.asyncop.application.loader;

import com.ryuqq.asyncop.core.retry.BackoffCalculator;

/**
 * CollectionLoader 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxRetries: 첫 시도 이후 최대 재시도 횟수 (기본 3, 총 4회 시도)</li>
 *   <li>baseDelayMs: 첫 재시도 전 대기 시간 (기본 500ms, 이후 두 배씩 증가)</li>
 *   <li>maxDelayMs: 재시도 대기 상한 (기본 30000ms)</li>
 *   <li>jitterFactor: 대기 시간에 더할 무작위 비율 (기본 0.0)</li>
 *   <li>timeoutMs: 조회 전체(재시도 포함)의 제한 시간 (기본 30000ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxRetries 최대 재시도 횟수 (0 이상)
 * @param baseDelayMs 기본 대기 시간 (밀리초, 양수)
 * @param maxDelayMs 최대 대기 시간 (밀리초, baseDelayMs 이상)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 * @param timeoutMs 제한 시간 (밀리초, 양수)
 */
public record LoaderConfig(
    int maxRetries,
    long baseDelayMs,
    long maxDelayMs,
    double jitterFactor,
    long timeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxRetries=3, baseDelayMs=500ms, maxDelayMs=30000ms, jitterFactor=0.0,
     * timeoutMs=30000ms</p>
     */
    public LoaderConfig() {
        this(3, 500, 30000, 0.0, 30000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LoaderConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries must be non-negative (current: " + maxRetries + ")"
            );
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs cannot be less than baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException(
                "timeoutMs must be positive (current: " + timeoutMs + ")"
            );
        }
    }

    /**
     * 설정값으로 BackoffCalculator 생성.
     *
     * @return BackoffCalculator
     */
    public BackoffCalculator toBackoffCalculator() {
        return new BackoffCalculator(baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * maxRetries만 변경한 새 인스턴스 생성.
     */
    public LoaderConfig withMaxRetries(int maxRetries) {
        return new LoaderConfig(maxRetries, baseDelayMs, maxDelayMs, jitterFactor, timeoutMs);
    }

    /**
     * baseDelayMs만 변경한 새 인스턴스 생성.
     */
    public LoaderConfig withBaseDelayMs(long baseDelayMs) {
        return new LoaderConfig(maxRetries, baseDelayMs, maxDelayMs, jitterFactor, timeoutMs);
    }

    /**
     * maxDelayMs만 변경한 새 인스턴스 생성.
     */
    public LoaderConfig withMaxDelayMs(long maxDelayMs) {
        return new LoaderConfig(maxRetries, baseDelayMs, maxDelayMs, jitterFactor, timeoutMs);
    }

    /**
     * jitterFactor만 변경한 새 인스턴스 생성.
     */
    public LoaderConfig withJitterFactor(double jitterFactor) {
        return new LoaderConfig(maxRetries, baseDelayMs, maxDelayMs, jitterFactor, timeoutMs);
    }

    /**
     * timeoutMs만 변경한 새 인스턴스 생성.
     */
    public LoaderConfig withTimeoutMs(long timeoutMs) {
        return new LoaderConfig(maxRetries, baseDelayMs, maxDelayMs, jitterFactor, timeoutMs);
    }
}
