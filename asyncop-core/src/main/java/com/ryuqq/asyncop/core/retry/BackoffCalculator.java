package com.ryuqq.asyncop.core.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential Backoff 계산기.
 *
 * <p>재시도 간격을 재시도마다 두 배로 늘립니다. 기본값은 jitter 없이
 * 500ms에서 시작합니다. 같은 백엔드를 향해 여러 인스턴스가 동시에 재시도하는 환경에서는
 * jitterFactor를 지정하여 재시도 시점을 분산시킬 수 있습니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(retryNumber-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=500ms, jitterFactor=0.0):</strong></p>
 * <ul>
 *   <li>retryNumber=1: 500ms</li>
 *   <li>retryNumber=2: 1000ms</li>
 *   <li>retryNumber=3: 2000ms</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=500ms, maxDelay=30000ms, jitterFactor=0.0</p>
     */
    public BackoffCalculator() {
        this(500, 30000, 0.0);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
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

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param retryNumber 재시도 순번 (1부터 시작, 첫 실패 후의 재시도가 1)
     * @return 재시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException retryNumber가 양수가 아닌 경우
     */
    public long calculate(int retryNumber) {
        if (retryNumber <= 0) {
            throw new IllegalArgumentException(
                "retryNumber must be positive (current: " + retryNumber + ")"
            );
        }

        // shift 폭 제한 (overflow 방지), 이후 maxDelay로 cap
        int shift = Math.min(retryNumber - 1, 30);
        long exponential = Math.min(baseDelayMs * (1L << shift), maxDelayMs);

        if (jitterFactor == 0.0) {
            return exponential;
        }
        long jitter = (long) (exponential * jitterFactor * ThreadLocalRandom.current().nextDouble());
        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    /**
     * @return 0.0이면 지연이 결정적
     */
    public double getJitterFactor() {
        return jitterFactor;
    }
}
