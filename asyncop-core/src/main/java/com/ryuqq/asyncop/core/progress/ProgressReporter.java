package com.ryuqq.asyncop.core.progress;

import java.beans.PropertyChangeListener;
import java.time.Duration;

/**
 * 진행률 보고 인터페이스.
 *
 * <p>진행률은 항상 [0, 100] 범위로 보정되며, 한 번의 보고 구간(reset ~ reset) 안에서는
 * 감소하지 않습니다. 값이 바뀌면 {@link #PROGRESS_PERCENTAGE} /
 * {@link #STATUS_MESSAGE} 속성 변경 이벤트가 발생합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ProgressReporter {

    /**
     * 진행률 속성 이름.
     */
    String PROGRESS_PERCENTAGE = "progressPercentage";

    /**
     * 상태 메시지 속성 이름.
     */
    String STATUS_MESSAGE = "statusMessage";

    /**
     * 진행률을 0으로 되돌리고 경과 시간 측정을 다시 시작.
     */
    void reset();

    /**
     * 진행률 보고.
     *
     * @param percentage 진행률 (범위 밖 값은 보정됨)
     */
    void reportProgress(double percentage);

    /**
     * 상태 메시지와 함께 진행률 보고.
     *
     * @param statusMessage 상태 메시지 (null이면 메시지 유지)
     * @param percentage 진행률
     */
    void reportProgress(String statusMessage, double percentage);

    /**
     * 현재 진행률 조회.
     *
     * @return 진행률 (0 ~ 100)
     */
    double getProgressPercentage();

    /**
     * 현재 상태 메시지 조회.
     *
     * @return 상태 메시지
     */
    String getStatusMessage();

    /**
     * 마지막 reset 이후 경과 시간.
     *
     * @return 경과 시간
     */
    Duration getElapsed();

    void addPropertyChangeListener(PropertyChangeListener listener);

    void removePropertyChangeListener(PropertyChangeListener listener);
}
