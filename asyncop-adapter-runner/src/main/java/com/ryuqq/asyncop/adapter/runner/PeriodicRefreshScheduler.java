package com.ryuqq.asyncop.adapter.runner;

import com.ryuqq.asyncop.application.loader.CollectionLoader;
import com.ryuqq.asyncop.core.outcome.LoadOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * CollectionLoader를 주기적으로 실행하는 스케줄러.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>이전 refresh가 끝난 뒤 intervalMs 후에 다음 refresh 실행 (fixed delay)</li>
 *   <li>refresh와 수동 load가 겹치면 loader의 SingleFlightGuard가 중복 실행을 막음 (Skipped)</li>
 *   <li>한 번의 refresh가 예외로 끝나도 기록 후 스케줄은 계속됨</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PeriodicRefreshScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PeriodicRefreshScheduler.class);

    private final CollectionLoader<?> loader;
    private final RefreshSchedulerConfig config;
    private final AtomicLong tickCount = new AtomicLong();
    private final AtomicReference<LoadOutcome> lastOutcome = new AtomicReference<>();
    private ScheduledExecutorService scheduler;

    /**
     * 스케줄러 생성.
     *
     * @param loader 주기적으로 실행할 loader
     * @param config 스케줄 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public PeriodicRefreshScheduler(CollectionLoader<?> loader, RefreshSchedulerConfig config) {
        if (loader == null) {
            throw new IllegalArgumentException("loader cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.loader = loader;
        this.config = config;
    }

    /**
     * 스케줄 시작.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public synchronized void start() {
        if (scheduler != null) {
            throw new IllegalStateException("Refresh scheduler for " + loader.getName() + " is already running");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "asyncop-refresh-" + loader.getName());
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::tick, config.initialDelayMs(), config.intervalMs(), TimeUnit.MILLISECONDS);
        log.info("Refresh scheduler started for {} (initialDelay={}ms, interval={}ms)",
            loader.getName(), config.initialDelayMs(), config.intervalMs());
    }

    /**
     * 스케줄 중지.
     *
     * <p>진행 중인 refresh가 끝날 때까지 최대 shutdownTimeoutMs 대기하고, 그래도 남아 있으면 강제 종료합니다.</p>
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public synchronized void stop() throws InterruptedException {
        if (scheduler == null) {
            return;
        }
        ScheduledExecutorService stopping = scheduler;
        scheduler = null;
        stopping.shutdown();
        if (!stopping.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            stopping.shutdownNow();
        }
        log.info("Refresh scheduler stopped for {} after {} ticks", loader.getName(), tickCount.get());
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    public long getTickCount() {
        return tickCount.get();
    }

    /**
     * 마지막 refresh 결과.
     *
     * @return 결과 (한 번도 완료되지 않았으면 empty)
     */
    public Optional<LoadOutcome> getLastOutcome() {
        return Optional.ofNullable(lastOutcome.get());
    }

    @Override
    public void close() {
        try {
            stop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping refresh scheduler for {}", loader.getName());
        }
    }

    void tick() {
        try {
            LoadOutcome outcome = loader.load();
            lastOutcome.set(outcome);
            log.debug("Refresh of {} finished: {}", loader.getName(), outcome);
        } catch (RuntimeException e) {
            log.error("Refresh of {} failed", loader.getName(), e);
        } finally {
            tickCount.incrementAndGet();
        }
    }
}
