package com.ryuqq.asyncop.application.executor;

import com.ryuqq.asyncop.core.statemachine.OperationPhase;
import com.ryuqq.asyncop.core.statemachine.PhaseTransition;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.OptionalDouble;

/**
 * UI에 바인딩되는 Operation 상태.
 *
 * <p>상태 변경은 {@link AsyncOperationExecutor}만 수행하며, 변경 시 java.beans 속성 변경
 * 이벤트가 발생합니다. 값은 volatile로 공개되어 어느 스레드에서나 읽을 수 있습니다.</p>
 *
 * <p><strong>불변식:</strong> loading이 false이면 statusMessage는 "" 이고 progress는 unset입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OperationState {

    public static final String LOADING = "loading";
    public static final String STATUS_MESSAGE = "statusMessage";
    public static final String PROGRESS_PERCENTAGE = "progressPercentage";
    public static final String PHASE = "phase";

    private final PropertyChangeSupport changes = new PropertyChangeSupport(this);
    private volatile boolean loading;
    private volatile String statusMessage = "";
    private volatile Double progressPercentage;
    private volatile OperationPhase phase = OperationPhase.IDLE;

    OperationState() {
    }

    public boolean isLoading() {
        return loading;
    }

    public String getStatusMessage() {
        return statusMessage;
    }

    /**
     * 진행률 조회.
     *
     * @return 진행률 (보고된 적이 없으면 empty)
     */
    public OptionalDouble getProgressPercentage() {
        Double current = progressPercentage;
        return current == null ? OptionalDouble.empty() : OptionalDouble.of(current);
    }

    public OperationPhase getPhase() {
        return phase;
    }

    public void addPropertyChangeListener(PropertyChangeListener listener) {
        changes.addPropertyChangeListener(listener);
    }

    public void removePropertyChangeListener(PropertyChangeListener listener) {
        changes.removePropertyChangeListener(listener);
    }

    void setLoading(boolean loading) {
        boolean old = this.loading;
        this.loading = loading;
        changes.firePropertyChange(LOADING, old, loading);
    }

    void setStatusMessage(String statusMessage) {
        String value = statusMessage == null ? "" : statusMessage;
        String old = this.statusMessage;
        this.statusMessage = value;
        changes.firePropertyChange(STATUS_MESSAGE, old, value);
    }

    /**
     * 진행률 갱신 (같은 loading 구간 안에서는 감소하지 않음).
     */
    void updateProgress(double percentage) {
        Double old = this.progressPercentage;
        double next = old == null ? percentage : Math.max(old, percentage);
        this.progressPercentage = next;
        changes.firePropertyChange(PROGRESS_PERCENTAGE, old, next);
    }

    void clearProgress() {
        Double old = this.progressPercentage;
        this.progressPercentage = null;
        changes.firePropertyChange(PROGRESS_PERCENTAGE, old, null);
    }

    void moveTo(OperationPhase next) {
        OperationPhase old = this.phase;
        this.phase = PhaseTransition.transition(old, next);
        changes.firePropertyChange(PHASE, old, next);
    }

    @Override
    public String toString() {
        return "OperationState{loading=" + loading
            + ", statusMessage='" + statusMessage + '\''
            + ", progress=" + progressPercentage
            + ", phase=" + phase + '}';
    }
}
