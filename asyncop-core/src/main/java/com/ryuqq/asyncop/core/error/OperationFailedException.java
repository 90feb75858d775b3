package com.ryuqq.asyncop.core.error;

/**
 * Operation 실패 (checked 예외 래핑용).
 *
 * <p>Operation이 checked 예외를 던진 경우 이 예외로 감싸 전파합니다.
 * unchecked 예외는 감싸지 않고 그대로 전파됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class OperationFailedException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 실패 설명
     * @param cause 원본 예외
     */
    public OperationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
