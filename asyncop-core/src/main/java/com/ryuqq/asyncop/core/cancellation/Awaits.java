package com.ryuqq.asyncop.core.cancellation;

import com.ryuqq.asyncop.core.error.OperationCancelledException;
import com.ryuqq.asyncop.core.error.OperationFailedException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Future 대기 유틸리티.
 *
 * <p>비동기 마샬링 결과를 블로킹으로 기다리면서 예외를 원래 형태로 되돌립니다.</p>
 * <ul>
 *   <li>ExecutionException: cause가 unchecked면 그대로, checked면 {@link OperationFailedException}</li>
 *   <li>InterruptedException / CancellationException: 인터럽트 플래그 복원 후 {@link OperationCancelledException}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Awaits {

    // Utility class - prevent instantiation
    private Awaits() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Future 완료 대기.
     *
     * @param future 대기할 Future
     * @param <T> 결과 타입
     * @return Future 결과
     */
    public static <T> T await(CompletableFuture<T> future) {
        if (future == null) {
            throw new IllegalArgumentException("future cannot be null");
        }
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted while awaiting completion", e);
        } catch (CancellationException e) {
            throw new OperationCancelledException("Awaited future was cancelled", e);
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        }
    }

    /**
     * 실패 원인을 unchecked 예외로 변환.
     *
     * @param cause 원인
     * @return 던질 RuntimeException (Error는 직접 던짐)
     */
    public static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new OperationFailedException("Operation failed: " + cause.getMessage(), cause);
    }
}
