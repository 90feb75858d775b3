package com.ryuqq.asyncop.core.error;

/**
 * 협력적 취소로 중단된 Operation.
 *
 * <p>호출자의 취소 요청 또는 취소 epoch 리셋으로 발생하며, 재시도 대상이 아닙니다.
 * Executor는 INFO 레벨로 기록한 뒤 호출자에게 그대로 전파합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class OperationCancelledException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 취소 사유
     */
    public OperationCancelledException(String message) {
        super(message);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param message 취소 사유
     * @param cause 취소를 유발한 예외 (예: InterruptedException)
     */
    public OperationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
