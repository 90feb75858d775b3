package com.ryuqq.asyncop.application.loader;

import com.ryuqq.asyncop.application.executor.AsyncOperationExecutor;
import com.ryuqq.asyncop.core.cancellation.Awaits;
import com.ryuqq.asyncop.core.cancellation.CancellationEpoch;
import com.ryuqq.asyncop.core.cancellation.CancellationSignal;
import com.ryuqq.asyncop.core.collection.ThreadSafeCollection;
import com.ryuqq.asyncop.core.error.OperationCancelledException;
import com.ryuqq.asyncop.core.guard.SingleFlightGuard;
import com.ryuqq.asyncop.core.outcome.Cancelled;
import com.ryuqq.asyncop.core.outcome.Failed;
import com.ryuqq.asyncop.core.outcome.LoadOutcome;
import com.ryuqq.asyncop.core.outcome.Loaded;
import com.ryuqq.asyncop.core.outcome.Skipped;
import com.ryuqq.asyncop.core.outcome.TimedOut;
import com.ryuqq.asyncop.core.progress.ProgressStep;
import com.ryuqq.asyncop.core.progress.StepProgressTracker;
import com.ryuqq.asyncop.core.retry.RetryPolicy;
import com.ryuqq.asyncop.core.spi.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Supplier;

/**
 * Repository의 전체 데이터를 UI 컬렉션으로 불러오는 guarded load.
 *
 * <p><strong>Load 흐름:</strong></p>
 * <pre>
 * load()
 *   ↓
 * SingleFlightGuard 진입 실패 → Skipped (상태 변경 없음)
 *   ↓
 * tracker.startOperation (6단계)
 *   ↓
 * executor.execute:
 *   0 Initializing → 1 Connecting
 *   → 2 Querying   : retry(fetchAll) vs timeout  ── 시간 초과 → TimedOut
 *   → 3 Processing : target.replaceAll(items)
 *   → 4 Updating   : 결과가 비면 fallback 항목 추가
 *   → 5 Finalizing : tracker.completeOperation → Loaded
 *   ↓
 * 취소 → Cancelled / 그 외 실패 → fallback 항목으로 교체 후 Failed
 *   ↓
 * guard 해제 (항상)
 * </pre>
 *
 * <p>조회는 실행기의 취소 epoch와 tracker의 취소 신호 둘 다에 연결된 신호로 실행되므로,
 * {@link AsyncOperationExecutor#cancelOperations()}와 {@link StepProgressTracker#cancelOperation()}
 * 어느 쪽으로도 취소할 수 있습니다.</p>
 *
 * @param <T> 항목 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CollectionLoader<T> {

    private static final Logger log = LoggerFactory.getLogger(CollectionLoader.class);

    static final String SKIPPED_REASON = "load already in progress";

    private final String name;
    private final Repository<T> repository;
    private final ThreadSafeCollection<T> target;
    private final AsyncOperationExecutor executor;
    private final StepProgressTracker tracker;
    private final LoaderConfig config;
    private final Supplier<List<T>> fallbackItems;
    private final Executor worker;
    private final RetryPolicy retryPolicy;
    private final TimeoutRace timeoutRace;
    private final SingleFlightGuard guard;

    /**
     * fallback 항목 없이 기본 워커 풀로 생성.
     */
    public CollectionLoader(String name,
                            Repository<T> repository,
                            ThreadSafeCollection<T> target,
                            AsyncOperationExecutor executor,
                            StepProgressTracker tracker,
                            LoaderConfig config) {
        this(name, repository, target, executor, tracker, config, List::of, ForkJoinPool.commonPool());
    }

    /**
     * Loader 생성.
     *
     * @param name load 대상 이름 (로그/상태 메시지에 사용)
     * @param repository 데이터 조회 Repository
     * @param target 결과를 반영할 컬렉션
     * @param executor Operation 실행기
     * @param tracker 단계 진행 추적기
     * @param config 재시도/제한 시간 설정
     * @param fallbackItems 조회 결과가 비었거나 실패했을 때 사용할 항목
     * @param worker 조회와 loadAsync에 사용할 워커 풀
     * @throws IllegalArgumentException 인자가 null이거나 name이 비어 있는 경우
     */
    public CollectionLoader(String name,
                            Repository<T> repository,
                            ThreadSafeCollection<T> target,
                            AsyncOperationExecutor executor,
                            StepProgressTracker tracker,
                            LoaderConfig config,
                            Supplier<List<T>> fallbackItems,
                            Executor worker) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (tracker == null) {
            throw new IllegalArgumentException("tracker cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (fallbackItems == null) {
            throw new IllegalArgumentException("fallbackItems cannot be null");
        }
        if (worker == null) {
            throw new IllegalArgumentException("worker cannot be null");
        }
        this.name = name;
        this.repository = repository;
        this.target = target;
        this.executor = executor;
        this.tracker = tracker;
        this.config = config;
        this.fallbackItems = fallbackItems;
        this.worker = worker;
        this.retryPolicy = new RetryPolicy(config.toBackoffCalculator());
        this.timeoutRace = new TimeoutRace(worker);
        this.guard = new SingleFlightGuard(name);
    }

    /**
     * Load 실행 (호출 스레드 블로킹).
     *
     * @return load 결과
     */
    public LoadOutcome load() {
        String loadId = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        log.info("Starting {} load - ID: {}", name, loadId);

        Optional<SingleFlightGuard.Permit> permit = guard.tryAcquire();
        if (permit.isEmpty()) {
            log.info("{} load already in progress, skipping duplicate request - ID: {}", name, loadId);
            return new Skipped(SKIPPED_REASON);
        }

        try (SingleFlightGuard.Permit ignored = permit.get()) {
            tracker.startOperation("Loading " + name, steps());
            try {
                return executor.execute(signal -> runLoad(loadId, signal), tracker.getReporter(), name + " load");
            } catch (OperationCancelledException e) {
                log.info("{} load was cancelled - ID: {}", name, loadId);
                return new Cancelled(e.getMessage());
            } catch (RuntimeException e) {
                log.warn("{} load failed, applying fallback items - ID: {} ({})", name, loadId, e.getMessage());
                return new Failed(e, replaceWithFallback(loadId));
            }
        }
    }

    /**
     * 워커 풀에서 load 실행.
     *
     * @return load 결과 Future
     */
    public CompletableFuture<LoadOutcome> loadAsync() {
        return CompletableFuture.supplyAsync(this::load, worker);
    }

    public String getName() {
        return name;
    }

    public LoaderConfig getConfig() {
        return config;
    }

    /**
     * load 진행 여부.
     *
     * @return load 중이면 true
     */
    public boolean isLoading() {
        return guard.isInFlight();
    }

    private LoadOutcome runLoad(String loadId, CancellationSignal executorSignal) {
        CancellationEpoch signal = CancellationEpoch.linked(executorSignal, tracker.getCancellationSignal());
        try {
            tracker.updateProgress(0, "Initializing " + name + " load...");
            tracker.updateProgress(1, "Connecting to data source...");

            RaceResult<List<T>> race = timeoutRace.run(
                raceSignal -> retryPolicy.executeWithRetry(
                    attemptSignal -> repository.fetchAll(), config.maxRetries(), raceSignal),
                config.timeoutMs(),
                signal
            );
            signal.throwIfCancelled();

            if (race.timedOut()) {
                log.warn("{} query timed out after {}ms - ID: {}", name, race.timeoutMs(), loadId);
                tracker.failOperation("Query timed out after " + race.timeoutMs() + "ms");
                return new TimedOut(race.timeoutMs());
            }

            List<T> items = race.value() == null ? List.of() : race.value();
            tracker.updateProgress(2, "Query completed - found " + items.size() + " items");
            log.info("{} query completed, item count: {} - ID: {}", name, items.size(), loadId);

            tracker.updateProgress(3, "Processing " + name + " data...");
            Awaits.await(target.replaceAllAsync(items));
            signal.throwIfCancelled();

            tracker.updateProgress(4, "Updating view...");
            boolean fallbackApplied = false;
            if (items.isEmpty()) {
                List<T> fallback = fallbackItems.get();
                if (fallback != null && !fallback.isEmpty()) {
                    log.info("No {} items found, adding fallback items - ID: {}", name, loadId);
                    tracker.updateProgress(4, "No items found - adding fallback items...");
                    Awaits.await(target.addRangeAsync(fallback));
                    fallbackApplied = true;
                }
            }
            signal.throwIfCancelled();

            tracker.updateProgress(5, "Completing " + name + " load...");
            tracker.completeOperation();
            log.info("{} load completed successfully - ID: {}", name, loadId);
            return new Loaded(target.size(), fallbackApplied);
        } catch (OperationCancelledException e) {
            tracker.failOperation("Operation was cancelled");
            throw e;
        } catch (RuntimeException e) {
            tracker.failOperation("Load failed: " + e.getMessage());
            throw e;
        } finally {
            signal.detach();
        }
    }

    private boolean replaceWithFallback(String loadId) {
        List<T> fallback = fallbackItems.get();
        if (fallback == null || fallback.isEmpty()) {
            return false;
        }
        try {
            Awaits.await(target.replaceAllAsync(fallback));
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to apply fallback items for {} - ID: {}", name, loadId, e);
            return false;
        }
    }

    private static List<ProgressStep> steps() {
        return List.of(
            ProgressStep.of("Initializing", "Preparing to load data"),
            ProgressStep.of("Connecting", "Establishing data source connection"),
            ProgressStep.of("Querying", "Executing query with retry logic"),
            ProgressStep.of("Processing", "Processing retrieved data"),
            ProgressStep.of("Updating", "Updating view with loaded data"),
            ProgressStep.of("Finalizing", "Completing data load")
        );
    }
}
