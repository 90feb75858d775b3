package com.ryuqq.asyncop.core.progress;

import com.ryuqq.asyncop.core.cancellation.Awaits;
import com.ryuqq.asyncop.core.cancellation.CancellationSignal;
import com.ryuqq.asyncop.core.cancellation.CancellationSource;
import com.ryuqq.asyncop.core.collection.ThreadSafeCollection;
import com.ryuqq.asyncop.core.spi.DispatcherBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.List;

/**
 * 이름 있는 단계들로 구성된 Operation의 진행 추적기.
 *
 * <p><strong>단계 상태 규칙:</strong></p>
 * <ul>
 *   <li>{@link #updateProgress(int, String)}: index 이전 단계는 completed, index 단계는 inProgress</li>
 *   <li>{@link #completeOperation()}: 모든 단계 completed</li>
 *   <li>{@link #failOperation(String)}: 남은 단계는 그대로 유지</li>
 * </ul>
 *
 * <p>단계 목록과 단계 플래그 변경은 {@link DispatcherBridge}를 통해 UI 컨텍스트에서 적용되며,
 * 호출자는 적용이 끝날 때까지 대기합니다. 바인딩된 {@link ProgressReporter}에는
 * {@code index * 100 / stepCount}가 보고됩니다.</p>
 *
 * <p>추적기는 자체 취소 신호를 가지며 {@link #startOperation(String, List)}마다 새 epoch로 교체됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StepProgressTracker implements AutoCloseable {

    private static final Logger defaultLog = LoggerFactory.getLogger(StepProgressTracker.class);

    public static final String STATUS_MESSAGE = "currentStatusMessage";
    public static final String STEP_INDEX = "currentStepIndex";
    public static final String OPERATION_IN_PROGRESS = "operationInProgress";
    public static final String CAN_CANCEL = "canCancel";

    static final String IDLE_STATUS = "Ready";

    private final DispatcherBridge dispatcher;
    private final Logger log;
    private final ProgressReporter reporter;
    private final ThreadSafeCollection<ProgressStep> steps;
    private final CancellationSource cancellation = new CancellationSource();
    private final PropertyChangeSupport changes = new PropertyChangeSupport(this);

    private volatile String operationName = "";
    private volatile String currentStatusMessage = IDLE_STATUS;
    private volatile int currentStepIndex = -1;
    private volatile boolean operationInProgress;
    private volatile boolean canCancel;

    /**
     * 기본 진행률 보고기로 추적기 생성.
     *
     * @param dispatcher UI 컨텍스트 마샬러
     */
    public StepProgressTracker(DispatcherBridge dispatcher) {
        this(dispatcher, defaultLog, new MonotonicProgressReporter());
    }

    /**
     * 추적기 생성.
     *
     * @param dispatcher UI 컨텍스트 마샬러
     * @param log 로거
     * @param reporter 바인딩할 진행률 보고기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public StepProgressTracker(DispatcherBridge dispatcher, Logger log, ProgressReporter reporter) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        if (reporter == null) {
            throw new IllegalArgumentException("reporter cannot be null");
        }
        this.dispatcher = dispatcher;
        this.log = log;
        this.reporter = reporter;
        this.steps = new ThreadSafeCollection<>(dispatcher);
    }

    /**
     * Operation 시작.
     *
     * <p>단계 목록을 교체하고 모든 단계 플래그를 초기화하며, 취소 신호와 진행률을 새로 시작합니다.</p>
     *
     * @param name Operation 이름
     * @param newSteps 단계 목록
     * @throws IllegalArgumentException name이 비어 있거나 newSteps가 null/empty인 경우
     */
    public void startOperation(String name, List<ProgressStep> newSteps) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (newSteps == null || newSteps.isEmpty()) {
            throw new IllegalArgumentException("steps cannot be null or empty");
        }
        List<ProgressStep> copied = List.copyOf(newSteps);

        onDispatcher(() -> {
            for (ProgressStep step : copied) {
                step.setCompleted(false);
                step.setInProgress(false);
            }
        });
        Awaits.await(steps.replaceAllAsync(copied));

        cancellation.reset();
        reporter.reset();
        this.operationName = name;
        setStepIndex(-1);
        setStatus("Initializing...");
        setOperationInProgress(true);
        setCanCancel(true);
        log.info("Operation started: {} ({} steps)", name, copied.size());
    }

    /**
     * 단계 진행.
     *
     * @param stepIndex 현재 단계 index
     * @param message 상태 메시지
     */
    public void updateProgress(int stepIndex, String message) {
        List<ProgressStep> current = steps.snapshot();
        if (stepIndex < 0 || stepIndex >= current.size()) {
            log.warn("Ignoring progress update for step {} of {} in operation {}",
                stepIndex, current.size(), operationName);
            return;
        }

        onDispatcher(() -> {
            for (int i = 0; i < current.size(); i++) {
                ProgressStep step = current.get(i);
                if (i < stepIndex) {
                    step.setInProgress(false);
                    step.setCompleted(true);
                } else if (i == stepIndex) {
                    step.setInProgress(true);
                }
            }
        });

        setStepIndex(stepIndex);
        if (message != null) {
            setStatus(message);
        }
        reporter.reportProgress(message, stepIndex * 100.0 / current.size());
    }

    /**
     * Operation 성공 완료.
     */
    public void completeOperation() {
        List<ProgressStep> current = steps.snapshot();
        onDispatcher(() -> {
            for (ProgressStep step : current) {
                step.setInProgress(false);
                step.setCompleted(true);
            }
        });
        setStepIndex(current.size() - 1);
        setStatus("Operation completed successfully");
        finish();
        reporter.reportProgress(currentStatusMessage, 100.0);
        log.info("Operation completed: {}", operationName);
    }

    /**
     * Operation 실패 처리.
     *
     * @param reason 실패 사유
     */
    public void failOperation(String reason) {
        setStatus("Operation failed: " + reason);
        finish();
        log.warn("Operation failed: {} ({})", operationName, reason);
    }

    /**
     * Operation 취소 요청.
     *
     * @return 취소 가능한 상태에서 취소된 경우 true
     */
    public boolean cancelOperation() {
        if (!canCancel) {
            return false;
        }
        cancellation.cancel();
        setStatus("Operation cancelled");
        finish();
        log.info("Operation cancelled: {}", operationName);
        return true;
    }

    /**
     * 추적기 초기화.
     */
    public void reset() {
        Awaits.await(steps.clearAsync());
        reporter.reset();
        this.operationName = "";
        setStepIndex(-1);
        setStatus(IDLE_STATUS);
        finish();
    }

    /**
     * 현재 Operation의 취소 신호.
     *
     * @return 취소 신호
     */
    public CancellationSignal getCancellationSignal() {
        return cancellation.current();
    }

    public ThreadSafeCollection<ProgressStep> getSteps() {
        return steps;
    }

    public ProgressReporter getReporter() {
        return reporter;
    }

    public String getOperationName() {
        return operationName;
    }

    public String getCurrentStatusMessage() {
        return currentStatusMessage;
    }

    public int getCurrentStepIndex() {
        return currentStepIndex;
    }

    public boolean isOperationInProgress() {
        return operationInProgress;
    }

    public boolean isCanCancel() {
        return canCancel;
    }

    public void addPropertyChangeListener(PropertyChangeListener listener) {
        changes.addPropertyChangeListener(listener);
    }

    public void removePropertyChangeListener(PropertyChangeListener listener) {
        changes.removePropertyChangeListener(listener);
    }

    @Override
    public void close() {
        cancellation.close();
    }

    private void onDispatcher(Runnable action) {
        Awaits.await(dispatcher.callOrRun(() -> {
            action.run();
            return null;
        }));
    }

    private void finish() {
        setOperationInProgress(false);
        setCanCancel(false);
    }

    private void setStatus(String status) {
        String old = this.currentStatusMessage;
        this.currentStatusMessage = status;
        changes.firePropertyChange(STATUS_MESSAGE, old, status);
    }

    private void setStepIndex(int index) {
        int old = this.currentStepIndex;
        this.currentStepIndex = index;
        changes.firePropertyChange(STEP_INDEX, old, index);
    }

    private void setOperationInProgress(boolean value) {
        boolean old = this.operationInProgress;
        this.operationInProgress = value;
        changes.firePropertyChange(OPERATION_IN_PROGRESS, old, value);
    }

    private void setCanCancel(boolean value) {
        boolean old = this.canCancel;
        this.canCancel = value;
        changes.firePropertyChange(CAN_CANCEL, old, value);
    }
}
