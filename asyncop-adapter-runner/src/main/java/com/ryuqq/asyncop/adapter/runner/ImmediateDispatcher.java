package com.ryuqq.asyncop.adapter.runner;

import com.ryuqq.asyncop.core.spi.DispatcherBridge;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * 호출 스레드에서 바로 실행하는 Dispatcher.
 *
 * <p>UI 스레드가 없는 배치/CLI 환경용입니다. 모든 스레드가 UI 컨텍스트로 취급되므로
 * 호출자 간의 직렬화는 보장하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ImmediateDispatcher implements DispatcherBridge {

    @Override
    public boolean checkAccess() {
        return true;
    }

    @Override
    public <T> CompletableFuture<T> callAsync(Callable<T> function) {
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
        try {
            return CompletableFuture.completedFuture(function.call());
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
