package com.ryuqq.asyncop.core.spi.noop;

import com.ryuqq.asyncop.core.spi.ErrorReporter;

/**
 * ErrorReporter NoOp 구현.
 *
 * <p>보고를 무시합니다. 오류는 Executor의 ERROR 로그로만 남습니다.
 * 헤드리스 환경이나 테스트에서 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpErrorReporter implements ErrorReporter {

    @Override
    public void reportError(String context, Throwable error) {
        // NoOp
    }
}
