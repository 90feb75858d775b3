package com.ryuqq.asyncop.application.loader;

import com.ryuqq.asyncop.core.cancellation.Awaits;
import com.ryuqq.asyncop.core.cancellation.CancellableOperation;
import com.ryuqq.asyncop.core.cancellation.CancellationEpoch;
import com.ryuqq.asyncop.core.cancellation.CancellationRegistration;
import com.ryuqq.asyncop.core.cancellation.CancellationSignal;
import com.ryuqq.asyncop.core.error.OperationCancelledException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Operation과 고정 지연 시간의 경주.
 *
 * <p>Operation은 워커 풀에서 부모 신호에 연결된 자식 epoch로 실행됩니다.</p>
 * <ul>
 *   <li>제한 시간 안에 끝나면 {@link RaceResult#completed}</li>
 *   <li>제한 시간이 먼저 지나면 자식 epoch를 취소하고 {@link RaceResult#timedOut}
 *       (진행 중인 재시도는 다음 확인 지점에서 멈춤)</li>
 *   <li>부모 신호가 취소되면 즉시 {@link OperationCancelledException}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TimeoutRace {

    private final Executor worker;

    public TimeoutRace(Executor worker) {
        if (worker == null) {
            throw new IllegalArgumentException("worker cannot be null");
        }
        this.worker = worker;
    }

    /**
     * 경주 실행 (호출 스레드 블로킹).
     *
     * @param operation 실행할 Operation
     * @param timeoutMs 제한 시간 (밀리초, 양수)
     * @param signal 부모 취소 신호
     * @param <T> 결과 타입
     * @return 경주 결과
     * @throws OperationCancelledException 부모 신호가 취소된 경우
     */
    public <T> RaceResult<T> run(CancellableOperation<T> operation, long timeoutMs, CancellationSignal signal) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive (current: " + timeoutMs + ")");
        }
        if (signal == null) {
            throw new IllegalArgumentException("signal cannot be null");
        }
        signal.throwIfCancelled();

        CancellationEpoch child = CancellationEpoch.linked(signal);
        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            try {
                return operation.run(child);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, worker);
        CancellationRegistration parentCancel = signal.onCancel(() -> future.completeExceptionally(
            new OperationCancelledException("Operation was cancelled: " + signal.getReason())));

        try {
            return RaceResult.completed(future.get(timeoutMs, TimeUnit.MILLISECONDS), timeoutMs);
        } catch (TimeoutException e) {
            child.cancel("timed out after " + timeoutMs + "ms");
            return RaceResult.timedOut(timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            child.cancel("interrupted");
            throw new OperationCancelledException("Interrupted while awaiting operation", e);
        } catch (CancellationException e) {
            throw new OperationCancelledException("Operation was cancelled", e);
        } catch (ExecutionException e) {
            throw Awaits.rethrow(e.getCause());
        } finally {
            parentCancel.close();
            child.detach();
        }
    }
}
