package com.ryuqq.asyncop.core.spi;

/**
 * 사용자 통지용 오류 보고 SPI.
 *
 * <p>Executor가 terminal failure를 기록한 뒤 호출합니다. UI 계층은 이 보고를 받아
 * 오류 대화상자나 알림을 표시합니다. 전역 싱글턴 대신 Executor에 주입됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ErrorReporter {

    /**
     * 오류 보고.
     *
     * @param context 실패한 Operation 설명 (예: status message)
     * @param error 발생한 예외
     */
    void reportError(String context, Throwable error);
}
