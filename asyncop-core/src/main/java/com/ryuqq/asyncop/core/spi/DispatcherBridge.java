package com.ryuqq.asyncop.core.spi;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * UI 전용 실행 컨텍스트로의 마샬링 SPI.
 *
 * <p>UI에 바인딩된 모든 상태는 하나의 직렬화된 실행 컨텍스트에서만 변경됩니다.
 * 이 인터페이스는 특정 UI 툴킷의 스레드 모델을 감추며, 헤드리스 환경에서는
 * 동기 pass-through 또는 단일 이벤트 루프 스레드로 구현할 수 있습니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>{@link #callAsync(Callable)}: UI 컨텍스트에서 실행, 예외는 Future를 통해 호출자에게 전파</li>
 *   <li>{@link #checkAccess()}: 호출 스레드가 이미 UI 컨텍스트인지 확인</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DispatcherBridge {

    /**
     * 호출 스레드가 UI 컨텍스트인지 확인.
     *
     * @return UI 컨텍스트에서 호출된 경우 true
     */
    boolean checkAccess();

    /**
     * 함수를 UI 컨텍스트에서 실행.
     *
     * @param function 실행할 함수
     * @param <T> 결과 타입
     * @return 실행 결과 Future (함수 예외 시 exceptionally 완료)
     */
    <T> CompletableFuture<T> callAsync(Callable<T> function);

    /**
     * 동작을 UI 컨텍스트에서 실행.
     *
     * @param action 실행할 동작
     * @return 완료 Future
     */
    default CompletableFuture<Void> invokeAsync(Runnable action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        return callAsync(() -> {
            action.run();
            return null;
        });
    }

    /**
     * 비동기 동작을 UI 컨텍스트에서 시작하고 그 완료까지 연결.
     *
     * @param asyncAction UI 컨텍스트에서 시작할 비동기 동작
     * @param <T> 결과 타입
     * @return 비동기 동작의 최종 결과 Future
     */
    default <T> CompletableFuture<T> composeAsync(Supplier<? extends CompletionStage<T>> asyncAction) {
        if (asyncAction == null) {
            throw new IllegalArgumentException("asyncAction cannot be null");
        }
        return callAsync(asyncAction::get).thenCompose(stage -> stage);
    }

    /**
     * UI 컨텍스트라면 즉시 실행, 아니면 마샬링.
     *
     * @param function 실행할 함수
     * @param <T> 결과 타입
     * @return 실행 결과 Future (즉시 실행 시 이미 완료됨)
     */
    default <T> CompletableFuture<T> callOrRun(Callable<T> function) {
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
        if (!checkAccess()) {
            return callAsync(function);
        }
        try {
            return CompletableFuture.completedFuture(function.call());
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
