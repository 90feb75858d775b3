package com.ryuqq.asyncop.adapter.runner;

import com.ryuqq.asyncop.core.spi.DispatcherBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 전용 스레드 하나를 UI 컨텍스트로 사용하는 Dispatcher.
 *
 * <p>모든 작업은 제출 순서대로 단일 daemon 스레드에서 직렬 실행됩니다.
 * 헤드리스 환경과 테스트에서 실제 UI 툴킷의 이벤트 스레드를 대신합니다.</p>
 *
 * <p><strong>종료:</strong> {@link #shutdown()} 이후 제출된 작업은 실행되지 않고
 * IllegalStateException으로 실패한 Future가 반환됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class EventLoopDispatcher implements DispatcherBridge, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventLoopDispatcher.class);

    private final String threadName;
    private final ExecutorService loop;
    private volatile Thread loopThread;

    public EventLoopDispatcher() {
        this("asyncop-ui");
    }

    /**
     * Dispatcher 생성.
     *
     * @param threadName 이벤트 루프 스레드 이름
     * @throws IllegalArgumentException threadName이 비어 있는 경우
     */
    public EventLoopDispatcher(String threadName) {
        if (threadName == null || threadName.isBlank()) {
            throw new IllegalArgumentException("threadName cannot be null or blank");
        }
        this.threadName = threadName;
        this.loop = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        });
    }

    @Override
    public boolean checkAccess() {
        return Thread.currentThread() == loopThread;
    }

    @Override
    public <T> CompletableFuture<T> callAsync(Callable<T> function) {
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            loop.execute(() -> {
                try {
                    future.complete(function.call());
                } catch (Exception e) {
                    future.completeExceptionally(e);
                } catch (Error e) {
                    log.error("Dispatched task failed with an error on {}", threadName, e);
                    future.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(
                new IllegalStateException("Dispatcher " + threadName + " has been shut down", e));
        }
        return future;
    }

    /**
     * 이벤트 루프 종료.
     *
     * <p>이미 제출된 작업이 끝날 때까지 최대 60초 대기하고, 그래도 남아 있으면 강제 종료합니다.</p>
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        loop.shutdown();
        if (!loop.awaitTermination(60, TimeUnit.SECONDS)) {
            loop.shutdownNow();
        }
    }

    public boolean isShutdown() {
        return loop.isShutdown();
    }

    @Override
    public void close() {
        try {
            shutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            loop.shutdownNow();
            log.warn("Interrupted while shutting down dispatcher {}", threadName);
        }
    }
}
