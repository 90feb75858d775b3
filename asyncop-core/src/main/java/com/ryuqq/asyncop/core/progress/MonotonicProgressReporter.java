package com.ryuqq.asyncop.core.progress;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.time.Duration;

/**
 * 단조 증가 진행률 보고기.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>보고 값은 [0, 100]으로 보정됩니다.</li>
 *   <li>이전 값보다 작은 보고는 무시됩니다 (진행률 유지).</li>
 *   <li>totalSteps가 지정되면 값은 100 / totalSteps 단위로 내림 양자화됩니다.
 *       단, 100은 항상 그대로 보고됩니다.</li>
 * </ul>
 *
 * <p>상태 계산은 lock 안에서, 이벤트 발행은 lock 밖에서 수행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MonotonicProgressReporter implements ProgressReporter {

    static final String INITIAL_STATUS = "Ready";

    private final PropertyChangeSupport changes = new PropertyChangeSupport(this);
    private final Object lock = new Object();
    private final int totalSteps;

    private double percentage;
    private String statusMessage = INITIAL_STATUS;
    private long startedAtNanos = System.nanoTime();

    /**
     * 연속 진행률 보고기 생성 (양자화 없음).
     */
    public MonotonicProgressReporter() {
        this.totalSteps = 0;
    }

    /**
     * 양자화 보고기 생성.
     *
     * @param totalSteps 전체 단계 수
     * @throws IllegalArgumentException totalSteps가 양수가 아닌 경우
     */
    public MonotonicProgressReporter(int totalSteps) {
        if (totalSteps <= 0) {
            throw new IllegalArgumentException(
                String.format("totalSteps must be positive (current: %d)", totalSteps)
            );
        }
        this.totalSteps = totalSteps;
    }

    @Override
    public void reset() {
        double oldPercentage;
        String oldStatus;
        synchronized (lock) {
            oldPercentage = percentage;
            oldStatus = statusMessage;
            percentage = 0.0;
            statusMessage = INITIAL_STATUS;
            startedAtNanos = System.nanoTime();
        }
        changes.firePropertyChange(PROGRESS_PERCENTAGE, oldPercentage, 0.0);
        changes.firePropertyChange(STATUS_MESSAGE, oldStatus, INITIAL_STATUS);
    }

    @Override
    public void reportProgress(double percentage) {
        reportProgress(null, percentage);
    }

    @Override
    public void reportProgress(String statusMessage, double percentage) {
        double normalized = quantize(clamp(percentage));
        double oldPercentage;
        double newPercentage;
        String oldStatus;
        String newStatus;
        synchronized (lock) {
            oldPercentage = this.percentage;
            oldStatus = this.statusMessage;
            this.percentage = Math.max(oldPercentage, normalized);
            if (statusMessage != null) {
                this.statusMessage = statusMessage;
            }
            newPercentage = this.percentage;
            newStatus = this.statusMessage;
        }
        changes.firePropertyChange(PROGRESS_PERCENTAGE, oldPercentage, newPercentage);
        changes.firePropertyChange(STATUS_MESSAGE, oldStatus, newStatus);
    }

    @Override
    public double getProgressPercentage() {
        synchronized (lock) {
            return percentage;
        }
    }

    @Override
    public String getStatusMessage() {
        synchronized (lock) {
            return statusMessage;
        }
    }

    @Override
    public Duration getElapsed() {
        synchronized (lock) {
            return Duration.ofNanos(System.nanoTime() - startedAtNanos);
        }
    }

    /**
     * 전체 단계 수 조회.
     *
     * @return 단계 수 (양자화하지 않으면 0)
     */
    public int getTotalSteps() {
        return totalSteps;
    }

    @Override
    public void addPropertyChangeListener(PropertyChangeListener listener) {
        changes.addPropertyChangeListener(listener);
    }

    @Override
    public void removePropertyChangeListener(PropertyChangeListener listener) {
        changes.removePropertyChangeListener(listener);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, value));
    }

    private double quantize(double value) {
        if (totalSteps == 0 || value >= 100.0) {
            return value;
        }
        double stepSize = 100.0 / totalSteps;
        return Math.floor(value / stepSize) * stepSize;
    }
}
