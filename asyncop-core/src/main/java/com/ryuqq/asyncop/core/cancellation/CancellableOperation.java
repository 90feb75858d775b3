package com.ryuqq.asyncop.core.cancellation;

/**
 * 취소 신호를 받는 작업 단위.
 *
 * @param <T> 결과 타입 (결과가 없으면 {@link Void})
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CancellableOperation<T> {

    /**
     * 작업 실행.
     *
     * @param signal 실행 중 주기적으로 확인해야 하는 취소 신호
     * @return 작업 결과
     * @throws Exception 작업 실패 시
     */
    T run(CancellationSignal signal) throws Exception;
}
