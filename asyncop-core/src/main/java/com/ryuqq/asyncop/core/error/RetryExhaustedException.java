package com.ryuqq.asyncop.core.error;

/**
 * 재시도 소진 (Terminal Failure).
 *
 * <p>모든 시도가 실패하여 더 이상 재시도하지 않는 상태를 나타냅니다.
 * 메시지에 실제 시도 횟수가 포함되며, 마지막 실패가 cause로 연결됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RetryExhaustedException extends RuntimeException {

    private final int attempts;

    /**
     * 생성자.
     *
     * @param attempts 수행한 시도 횟수 (1 이상)
     * @param lastFailure 마지막 시도의 실패 원인
     */
    public RetryExhaustedException(int attempts, Throwable lastFailure) {
        super("Operation failed after " + attempts + " attempts", lastFailure);
        this.attempts = attempts;
    }

    /**
     * 수행한 시도 횟수 조회.
     *
     * @return 시도 횟수
     */
    public int getAttempts() {
        return attempts;
    }
}
