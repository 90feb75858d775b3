package com.ryuqq.asyncop.core.cancellation;

/**
 * 취소 콜백 등록 핸들.
 *
 * <p>try-with-resources로 사용하여 더 이상 필요 없는 콜백을 해제합니다.
 * 오래 사용되는 epoch에 콜백이 누적되지 않도록 해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CancellationRegistration extends AutoCloseable {

    /**
     * 아무 것도 해제하지 않는 핸들.
     */
    CancellationRegistration EMPTY = () -> { };

    /**
     * 콜백 등록 해제 (멱등).
     */
    @Override
    void close();
}
