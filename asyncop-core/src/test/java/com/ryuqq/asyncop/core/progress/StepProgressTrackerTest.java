package com.ryuqq.asyncop.core.progress;

import com.ryuqq.asyncop.core.cancellation.CancellationSignal;
import com.ryuqq.asyncop.core.support.SingleThreadDispatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StepProgressTracker 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StepProgressTrackerTest {

    private SingleThreadDispatcher dispatcher;
    private MonotonicProgressReporter reporter;
    private StepProgressTracker tracker;

    @BeforeEach
    void setUp() {
        dispatcher = new SingleThreadDispatcher();
        reporter = new MonotonicProgressReporter();
        tracker = new StepProgressTracker(
            dispatcher, LoggerFactory.getLogger(StepProgressTrackerTest.class), reporter);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        tracker.close();
        dispatcher.close();
    }

    @Test
    void startOperation_초기_상태() {
        // when
        tracker.startOperation("Load", steps());

        // then
        assertThat(tracker.isOperationInProgress()).isTrue();
        assertThat(tracker.isCanCancel()).isTrue();
        assertThat(tracker.getCurrentStatusMessage()).isEqualTo("Initializing...");
        assertThat(tracker.getOperationName()).isEqualTo("Load");
        assertThat(tracker.getSteps().size()).isEqualTo(4);
        assertThat(tracker.getSteps()).noneMatch(ProgressStep::isCompleted);
    }

    @Test
    void updateProgress_이전_단계_완료_현재_단계_진행중() {
        // given
        tracker.startOperation("Load", steps());

        // when
        tracker.updateProgress(2, "Processing data...");

        // then
        List<ProgressStep> snapshot = tracker.getSteps().snapshot();
        assertThat(snapshot.get(0).isCompleted()).isTrue();
        assertThat(snapshot.get(1).isCompleted()).isTrue();
        assertThat(snapshot.get(2).isInProgress()).isTrue();
        assertThat(snapshot.get(2).isCompleted()).isFalse();
        assertThat(snapshot.get(3).isInProgress()).isFalse();
        assertThat(tracker.getCurrentStepIndex()).isEqualTo(2);
        assertThat(tracker.getCurrentStatusMessage()).isEqualTo("Processing data...");
        assertThat(reporter.getProgressPercentage()).isEqualTo(50.0);
    }

    @Test
    void updateProgress_범위_밖_index는_무시() {
        // given
        tracker.startOperation("Load", steps());
        tracker.updateProgress(1, "Connecting...");

        // when
        tracker.updateProgress(9, "Unknown");

        // then
        assertThat(tracker.getCurrentStepIndex()).isEqualTo(1);
        assertThat(tracker.getCurrentStatusMessage()).isEqualTo("Connecting...");
    }

    @Test
    void 단계_플래그는_UI_스레드에서_변경() {
        // given
        tracker.startOperation("Load", steps());
        List<Thread> mutators = new CopyOnWriteArrayList<>();
        tracker.getSteps().get(0).addPropertyChangeListener(event -> mutators.add(Thread.currentThread()));

        // when
        tracker.updateProgress(1, "Step 2");

        // then
        assertThat(mutators).isNotEmpty();
        assertThat(mutators).allMatch(dispatcher::isUiThread);
    }

    @Test
    void completeOperation_모든_단계_완료() {
        // given
        tracker.startOperation("Load", steps());
        tracker.updateProgress(1, "Step 2");

        // when
        tracker.completeOperation();

        // then
        assertThat(tracker.getSteps()).allMatch(ProgressStep::isCompleted);
        assertThat(tracker.getSteps()).noneMatch(ProgressStep::isInProgress);
        assertThat(tracker.isOperationInProgress()).isFalse();
        assertThat(tracker.isCanCancel()).isFalse();
        assertThat(tracker.getCurrentStatusMessage()).isEqualTo("Operation completed successfully");
        assertThat(reporter.getProgressPercentage()).isEqualTo(100.0);
    }

    @Test
    void failOperation_남은_단계는_그대로() {
        // given
        tracker.startOperation("Load", steps());
        tracker.updateProgress(1, "Step 2");

        // when
        tracker.failOperation("timeout");

        // then
        List<ProgressStep> snapshot = tracker.getSteps().snapshot();
        assertThat(snapshot.get(0).isCompleted()).isTrue();
        assertThat(snapshot.get(3).isCompleted()).isFalse();
        assertThat(tracker.getCurrentStatusMessage()).isEqualTo("Operation failed: timeout");
        assertThat(tracker.isOperationInProgress()).isFalse();
    }

    @Test
    void cancelOperation_신호_취소() {
        // given
        tracker.startOperation("Load", steps());
        CancellationSignal signal = tracker.getCancellationSignal();

        // when
        boolean cancelled = tracker.cancelOperation();

        // then
        assertThat(cancelled).isTrue();
        assertThat(signal.isCancelled()).isTrue();
        assertThat(tracker.getCurrentStatusMessage()).isEqualTo("Operation cancelled");
        assertThat(tracker.cancelOperation()).isFalse();
    }

    @Test
    void startOperation_새_신호_발급() {
        // given
        tracker.startOperation("Load", steps());
        tracker.cancelOperation();

        // when
        tracker.startOperation("Load again", steps());

        // then
        assertThat(tracker.getCancellationSignal().isCancelled()).isFalse();
        assertThat(tracker.getSteps()).noneMatch(ProgressStep::isCompleted);
    }

    @Test
    void reset_단계_비우고_초기화() {
        // given
        tracker.startOperation("Load", steps());

        // when
        tracker.reset();

        // then
        assertThat(tracker.getSteps().isEmpty()).isTrue();
        assertThat(tracker.getCurrentStepIndex()).isEqualTo(-1);
        assertThat(tracker.getCurrentStatusMessage()).isEqualTo("Ready");
        assertThat(tracker.isOperationInProgress()).isFalse();
    }

    @Test
    void 빈_단계_목록은_예외() {
        assertThatThrownBy(() -> tracker.startOperation("Load", List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static List<ProgressStep> steps() {
        return List.of(
            ProgressStep.of("Step 1", "first"),
            ProgressStep.of("Step 2", "second"),
            ProgressStep.of("Step 3", "third"),
            ProgressStep.of("Step 4", "fourth")
        );
    }
}
