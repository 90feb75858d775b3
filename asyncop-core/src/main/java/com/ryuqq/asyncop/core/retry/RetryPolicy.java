package com.ryuqq.asyncop.core.retry;

import com.ryuqq.asyncop.core.cancellation.CancellableOperation;
import com.ryuqq.asyncop.core.cancellation.CancellationSignal;
import com.ryuqq.asyncop.core.error.OperationCancelledException;
import com.ryuqq.asyncop.core.error.RetryExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 제한된 횟수의 Exponential Backoff 재시도 정책.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * for attempt in 0..maxRetries:
 *   1. 취소 확인
 *   2. operation 실행 → 성공 시 결과 반환
 *   3. 실패 (취소 제외):
 *      - 남은 시도 없음 → RetryExhaustedException
 *      - WARN 로그 → 취소 확인 → backoff 대기 (취소 시 즉시 중단)
 * </pre>
 *
 * <p>취소는 재시도하지 않습니다. backoff 대기는 취소 신호에 대한 대기로 구현되어
 * 대기 중 취소가 들어오면 남은 지연을 기다리지 않고 즉시 중단합니다.</p>
 *
 * <p>이 클래스는 상태가 없으므로 thread-safe합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RetryPolicy {

    private final BackoffCalculator backoffCalculator;
    private final Logger log;

    /**
     * 생성자 (기본 BackoffCalculator: 500ms 시작, jitter 없음).
     */
    public RetryPolicy() {
        this(new BackoffCalculator());
    }

    /**
     * 생성자 (커스텀 BackoffCalculator 주입).
     *
     * @param backoffCalculator 백오프 계산기
     * @throws IllegalArgumentException backoffCalculator가 null인 경우
     */
    public RetryPolicy(BackoffCalculator backoffCalculator) {
        this(backoffCalculator, LoggerFactory.getLogger(RetryPolicy.class));
    }

    /**
     * 생성자 (BackoffCalculator와 Logger 주입).
     *
     * @param backoffCalculator 백오프 계산기
     * @param log 재시도 경고를 기록할 Logger
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryPolicy(BackoffCalculator backoffCalculator, Logger log) {
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        this.backoffCalculator = backoffCalculator;
        this.log = log;
    }

    /**
     * 재시도를 적용하여 operation 실행.
     *
     * @param operation 실행할 작업
     * @param maxRetries 최대 재시도 횟수 (0 이상, 총 시도 횟수는 maxRetries + 1)
     * @param signal 취소 신호
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws OperationCancelledException 취소된 경우
     * @throws RetryExhaustedException 모든 시도가 실패한 경우
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public <T> T executeWithRetry(CancellableOperation<T> operation, int maxRetries, CancellationSignal signal) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative (current: " + maxRetries + ")");
        }
        if (signal == null) {
            throw new IllegalArgumentException("signal cannot be null");
        }

        Exception lastFailure = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            signal.throwIfCancelled();
            try {
                return operation.run(signal);
            } catch (OperationCancelledException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationCancelledException("Interrupted during attempt " + (attempt + 1), e);
            } catch (Exception e) {
                if (signal.isCancelled()) {
                    throw new OperationCancelledException("Operation was cancelled: " + signal.getReason(), e);
                }
                lastFailure = e;
                if (attempt == maxRetries) {
                    break;
                }
                long delayMs = backoffCalculator.calculate(attempt + 1);
                log.warn("Attempt {} failed, retrying in {}ms", attempt + 1, delayMs, e);
                sleepUnlessCancelled(delayMs, signal);
            }
        }

        throw new RetryExhaustedException(maxRetries + 1, lastFailure);
    }

    /**
     * Backoff 대기 (취소 시 즉시 중단).
     *
     * @param delayMs 대기 시간 (밀리초)
     * @param signal 취소 신호
     * @throws OperationCancelledException 대기 전 또는 대기 중 취소된 경우
     */
    private void sleepUnlessCancelled(long delayMs, CancellationSignal signal) {
        signal.throwIfCancelled();
        try {
            if (signal.awaitCancellation(delayMs)) {
                throw new OperationCancelledException("Cancelled during retry backoff: " + signal.getReason());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted during retry backoff", e);
        }
    }

    /**
     * 백오프 계산기 조회.
     *
     * @return 백오프 계산기
     */
    public BackoffCalculator getBackoffCalculator() {
        return backoffCalculator;
    }
}
