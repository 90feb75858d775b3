package com.ryuqq.asyncop.core.progress;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;

/**
 * 다단계 Operation의 한 단계.
 *
 * <p>title/description은 불변이며, completed/inProgress 플래그는
 * {@link StepProgressTracker}가 UI 컨텍스트에서만 변경합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ProgressStep {

    public static final String COMPLETED = "completed";
    public static final String IN_PROGRESS = "inProgress";

    private final PropertyChangeSupport changes = new PropertyChangeSupport(this);
    private final String title;
    private final String description;
    private volatile boolean completed;
    private volatile boolean inProgress;

    /**
     * 단계 생성.
     *
     * @param title 단계 제목
     * @param description 단계 설명
     * @throws IllegalArgumentException title이 null이거나 비어 있는 경우
     */
    public ProgressStep(String title, String description) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or blank");
        }
        this.title = title;
        this.description = description == null ? "" : description;
    }

    public static ProgressStep of(String title, String description) {
        return new ProgressStep(title, description);
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public boolean isCompleted() {
        return completed;
    }

    public boolean isInProgress() {
        return inProgress;
    }

    void setCompleted(boolean completed) {
        boolean old = this.completed;
        this.completed = completed;
        changes.firePropertyChange(COMPLETED, old, completed);
    }

    void setInProgress(boolean inProgress) {
        boolean old = this.inProgress;
        this.inProgress = inProgress;
        changes.firePropertyChange(IN_PROGRESS, old, inProgress);
    }

    public void addPropertyChangeListener(PropertyChangeListener listener) {
        changes.addPropertyChangeListener(listener);
    }

    public void removePropertyChangeListener(PropertyChangeListener listener) {
        changes.removePropertyChangeListener(listener);
    }

    @Override
    public String toString() {
        return "ProgressStep{title='" + title + "', completed=" + completed + ", inProgress=" + inProgress + '}';
    }
}
