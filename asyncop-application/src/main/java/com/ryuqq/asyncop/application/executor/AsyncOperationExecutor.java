package com.ryuqq.asyncop.application.executor;

import com.ryuqq.asyncop.core.cancellation.CancellableOperation;
import com.ryuqq.asyncop.core.cancellation.CancellationSignal;
import com.ryuqq.asyncop.core.cancellation.CancellationSource;
import com.ryuqq.asyncop.core.error.OperationCancelledException;
import com.ryuqq.asyncop.core.error.OperationFailedException;
import com.ryuqq.asyncop.core.progress.ProgressReporter;
import com.ryuqq.asyncop.core.spi.ErrorReporter;
import com.ryuqq.asyncop.core.spi.noop.NoOpErrorReporter;
import com.ryuqq.asyncop.core.statemachine.OperationPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.beans.PropertyChangeListener;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * 비동기 Operation 실행기.
 *
 * <p>Operation 하나를 실행하는 동안 {@link OperationState}를 loading 상태로 표시하고,
 * 결과와 관계없이 마지막에 상태를 {@code {false, "", unset}}으로 되돌립니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * execute(op, reporter, status)
 *   ↓
 * enter: IDLE → LOADING, loading=true, statusMessage=status
 *   ↓
 * op.run(currentEpoch)   (reporter 진행률은 state로 반영)
 *   ├─ 성공          → reporter 100%, SUCCEEDED
 *   ├─ 취소          → INFO 로그, CANCELLED, 재전파
 *   └─ 그 외 실패    → ERROR 로그, ErrorReporter 통지, FAILED, 재전파
 *   ↓
 * exit: terminal → IDLE, loading=false, statusMessage="", progress unset
 * </pre>
 *
 * <p><strong>겹치는 호출:</strong> 같은 실행기에서 동시에 실행되는 Operation들은 하나의 loading 구간을
 * 공유합니다 (참조 카운트). 마지막 Operation이 끝날 때만 상태가 정리되므로 loading 값이
 * Operation마다 따로 뒤집히지 않습니다.</p>
 *
 * <p>enter 도중 상태 리스너가 실패해도 exit는 실행됩니다. 정리 단계에서 리스너가 실패하면
 * ERROR 로그를 남기고 나머지 정리를 계속합니다.</p>
 *
 * <p><strong>스레드:</strong> {@link #execute} 는 호출 스레드를 블로킹하므로 워커 스레드에서 호출해야 합니다.
 * {@link #executeAsync} 는 워커 풀에 제출합니다. 상태 변경 이벤트는 변경한 스레드에서 발생합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class AsyncOperationExecutor implements AutoCloseable {

    private static final Logger defaultLog = LoggerFactory.getLogger(AsyncOperationExecutor.class);

    private final Logger log;
    private final ErrorReporter errorReporter;
    private final Executor worker;
    private final CancellationSource cancellation = new CancellationSource();
    private final OperationState state = new OperationState();
    private final Object stateLock = new Object();

    private int activeOperations;

    /**
     * 기본 설정으로 실행기 생성 (NoOp 오류 보고, 공용 ForkJoinPool).
     */
    public AsyncOperationExecutor() {
        this(new NoOpErrorReporter());
    }

    /**
     * 오류 보고기를 지정하여 실행기 생성.
     *
     * @param errorReporter 오류 보고기
     */
    public AsyncOperationExecutor(ErrorReporter errorReporter) {
        this(defaultLog, errorReporter, ForkJoinPool.commonPool());
    }

    /**
     * 실행기 생성.
     *
     * @param log 로거
     * @param errorReporter 오류 보고기
     * @param worker executeAsync에 사용할 워커 풀
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public AsyncOperationExecutor(Logger log, ErrorReporter errorReporter, Executor worker) {
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        if (errorReporter == null) {
            throw new IllegalArgumentException("errorReporter cannot be null");
        }
        if (worker == null) {
            throw new IllegalArgumentException("worker cannot be null");
        }
        this.log = log;
        this.errorReporter = errorReporter;
        this.worker = worker;
    }

    /**
     * Operation 실행 (진행률 보고 없음).
     *
     * @param operation 실행할 Operation
     * @param <T> 결과 타입
     * @return Operation 결과
     */
    public <T> T execute(CancellableOperation<T> operation) {
        return execute(operation, null, null);
    }

    /**
     * Operation 실행.
     *
     * @param operation 실행할 Operation (현재 취소 epoch를 인자로 받음)
     * @param progressReporter 진행률 보고기 (nullable)
     * @param statusMessage 실행 중 상태 메시지 (nullable)
     * @param <T> 결과 타입
     * @return Operation 결과
     * @throws IllegalArgumentException operation이 null인 경우
     * @throws IllegalStateException 실행기가 dispose된 경우
     * @throws OperationCancelledException 취소된 경우
     * @throws OperationFailedException Operation이 checked 예외로 실패한 경우
     */
    public <T> T execute(CancellableOperation<T> operation, ProgressReporter progressReporter, String statusMessage) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        ensureNotDisposed();
        CancellationSignal signal = cancellation.current();

        PropertyChangeListener progressMirror = null;
        if (progressReporter != null) {
            progressReporter.reset();
            progressMirror = event -> {
                if (ProgressReporter.PROGRESS_PERCENTAGE.equals(event.getPropertyName())
                        && event.getNewValue() instanceof Double) {
                    mirrorProgress((Double) event.getNewValue());
                }
            };
        }

        OperationPhase terminal = OperationPhase.FAILED;
        try {
            enter(statusMessage);
            if (progressMirror != null) {
                progressReporter.addPropertyChangeListener(progressMirror);
            }
            T result = operation.run(signal);
            if (progressReporter != null) {
                progressReporter.reportProgress(100.0);
            }
            terminal = OperationPhase.SUCCEEDED;
            return result;
        } catch (OperationCancelledException e) {
            terminal = OperationPhase.CANCELLED;
            log.info("Operation cancelled: {}", e.getMessage());
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            terminal = OperationPhase.CANCELLED;
            log.info("Operation interrupted");
            throw new OperationCancelledException("Operation was interrupted", e);
        } catch (RuntimeException e) {
            log.error("Operation failed: {}", e.getMessage(), e);
            reportError(statusMessage, e);
            throw e;
        } catch (Exception e) {
            log.error("Operation failed: {}", e.getMessage(), e);
            reportError(statusMessage, e);
            throw new OperationFailedException("Operation failed: " + e.getMessage(), e);
        } finally {
            if (progressMirror != null) {
                progressReporter.removePropertyChangeListener(progressMirror);
            }
            exit(terminal);
        }
    }

    /**
     * 워커 풀에서 Operation 실행.
     *
     * @param operation 실행할 Operation
     * @param progressReporter 진행률 보고기 (nullable)
     * @param statusMessage 상태 메시지 (nullable)
     * @param <T> 결과 타입
     * @return 결과 Future (실패/취소 시 CompletionException으로 감싼 원인)
     */
    public <T> CompletableFuture<T> executeAsync(CancellableOperation<T> operation,
                                                 ProgressReporter progressReporter,
                                                 String statusMessage) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        ensureNotDisposed();
        return CompletableFuture.supplyAsync(() -> execute(operation, progressReporter, statusMessage), worker);
    }

    /**
     * 현재 epoch에서 실행 중인 모든 Operation 취소 요청.
     */
    public void cancelOperations() {
        if (cancellation.cancel()) {
            log.info("Cancellation requested for running operations");
        }
    }

    /**
     * 취소된 epoch를 새 epoch로 교체.
     *
     * <p>이후 시작되는 Operation은 이전 취소의 영향을 받지 않습니다.</p>
     */
    public void resetCancellation() {
        cancellation.reset();
        log.debug("Cancellation epoch reset");
    }

    /**
     * 현재 취소 신호 조회.
     *
     * @return 현재 epoch
     */
    public CancellationSignal getCancellationSignal() {
        return cancellation.current();
    }

    public OperationState getState() {
        return state;
    }

    public boolean isDisposed() {
        return cancellation.isDisposed();
    }

    /**
     * dispose: 현재 epoch를 취소하고 이후 실행을 거부.
     */
    @Override
    public void close() {
        if (!cancellation.isDisposed()) {
            cancellation.close();
            log.info("AsyncOperationExecutor disposed");
        }
    }

    private void enter(String statusMessage) {
        synchronized (stateLock) {
            if (activeOperations++ == 0) {
                state.moveTo(OperationPhase.LOADING);
                state.clearProgress();
                state.setLoading(true);
            }
            state.setStatusMessage(statusMessage);
        }
    }

    private void exit(OperationPhase terminal) {
        synchronized (stateLock) {
            if (--activeOperations > 0) {
                return;
            }
            runCleanupStep(() -> {
                if (state.getPhase() == OperationPhase.LOADING) {
                    state.moveTo(terminal);
                }
            });
            runCleanupStep(() -> {
                if (state.getPhase().isTerminal()) {
                    state.moveTo(OperationPhase.IDLE);
                }
            });
            runCleanupStep(() -> state.setLoading(false));
            runCleanupStep(() -> state.setStatusMessage(""));
            runCleanupStep(state::clearProgress);
        }
    }

    private void runCleanupStep(Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            log.error("State listener failed during cleanup: {}", e.getMessage(), e);
        }
    }

    private void mirrorProgress(double percentage) {
        synchronized (stateLock) {
            if (activeOperations > 0) {
                state.updateProgress(percentage);
            }
        }
    }

    private void reportError(String context, Throwable error) {
        try {
            errorReporter.reportError(context == null ? "operation" : context, error);
        } catch (RuntimeException e) {
            log.error("Error reporter failed while reporting: {}", error.getMessage(), e);
        }
    }

    private void ensureNotDisposed() {
        if (cancellation.isDisposed()) {
            throw new IllegalStateException("AsyncOperationExecutor has been disposed");
        }
    }
}
