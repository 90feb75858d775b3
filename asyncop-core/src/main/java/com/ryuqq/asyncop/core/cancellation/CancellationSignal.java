package com.ryuqq.asyncop.core.cancellation;

import com.ryuqq.asyncop.core.error.OperationCancelledException;

/**
 * 협력적 취소 신호.
 *
 * <p>Operation은 이 신호를 주기적으로 확인하여 취소 요청 시 스스로 중단해야 합니다.
 * 신호는 한 번 취소되면 다시 취소되지 않은 상태로 돌아가지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * signal.throwIfCancelled();
 * if (signal.awaitCancellation(500)) {
 *     // 500ms 대기 중 취소됨
 * }
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CancellationSignal {

    /**
     * 취소 여부 확인.
     *
     * @return 취소된 경우 true
     */
    boolean isCancelled();

    /**
     * 취소 사유 조회.
     *
     * @return 취소 사유 (취소되지 않았으면 null)
     */
    String getReason();

    /**
     * 취소될 때까지 최대 timeoutMs 동안 대기.
     *
     * <p>백오프 대기처럼 "잠들되 취소되면 즉시 깨어나야 하는" 지점에서 사용합니다.</p>
     *
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @return 대기 중(또는 이미) 취소된 경우 true, 시간이 다 지난 경우 false
     * @throws InterruptedException 대기 중 스레드가 인터럽트된 경우
     */
    boolean awaitCancellation(long timeoutMs) throws InterruptedException;

    /**
     * 취소 시 실행할 콜백 등록.
     *
     * <p>이미 취소된 상태라면 콜백은 호출 스레드에서 즉시 실행됩니다.</p>
     *
     * @param callback 취소 콜백
     * @return 등록 해제 핸들
     */
    CancellationRegistration onCancel(Runnable callback);

    /**
     * 취소된 경우 {@link OperationCancelledException} 발생.
     *
     * @throws OperationCancelledException 취소된 경우
     */
    default void throwIfCancelled() {
        if (isCancelled()) {
            throw new OperationCancelledException("Operation was cancelled: " + getReason());
        }
    }
}
