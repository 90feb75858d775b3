package com.ryuqq.asyncop.core.cancellation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 세대(generation) 단위 취소 신호.
 *
 * <p>하나의 epoch는 한 번만 취소될 수 있습니다. {@link CancellationSource#reset()}이 호출되면
 * 이전 epoch는 취소되고 다음 세대의 epoch가 발급되므로, 이전 epoch에서 시작한 작업은
 * 새 epoch 아래에서 조용히 계속 실행되지 않고 취소를 관찰합니다.</p>
 *
 * <p><strong>Linked Epoch:</strong> {@link #linked(CancellationSignal...)}로 생성한 epoch는
 * 부모 신호 중 하나라도 취소되면 함께 취소됩니다. 사용 후 {@link #detach()}로
 * 부모에 등록한 콜백을 해제해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CancellationEpoch implements CancellationSignal {

    private static final Logger log = LoggerFactory.getLogger(CancellationEpoch.class);

    private final long generation;
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private final List<CancellationRegistration> parentRegistrations = new ArrayList<>();
    private volatile String reason;

    private CancellationEpoch(long generation) {
        this.generation = generation;
    }

    /**
     * 첫 세대 epoch 생성.
     *
     * @return generation=1인 epoch
     */
    public static CancellationEpoch first() {
        return new CancellationEpoch(1);
    }

    /**
     * 부모 신호에 연결된 epoch 생성.
     *
     * <p>부모 중 하나가 취소되면 이 epoch도 취소됩니다. 부모가 이미 취소된 상태라면
     * 생성 즉시 취소된 epoch가 반환됩니다.</p>
     *
     * @param parents 부모 신호 (1개 이상)
     * @return 연결된 epoch (generation=0)
     * @throws IllegalArgumentException parents가 비어 있거나 null 요소가 있는 경우
     */
    public static CancellationEpoch linked(CancellationSignal... parents) {
        if (parents == null || parents.length == 0) {
            throw new IllegalArgumentException("parents cannot be empty");
        }
        CancellationEpoch child = new CancellationEpoch(0);
        for (CancellationSignal parent : parents) {
            if (parent == null) {
                throw new IllegalArgumentException("parent signal cannot be null");
            }
            CancellationRegistration registration =
                parent.onCancel(() -> child.cancel("linked signal cancelled: " + parent.getReason()));
            synchronized (child.parentRegistrations) {
                child.parentRegistrations.add(registration);
            }
        }
        return child;
    }

    /**
     * 다음 세대 epoch 생성.
     *
     * @return generation이 1 증가한 새 epoch
     */
    CancellationEpoch next() {
        return new CancellationEpoch(generation + 1);
    }

    /**
     * epoch 취소.
     *
     * <p>처음 호출된 경우에만 등록된 콜백을 실행합니다. 콜백에서 발생한 예외는
     * 기록 후 나머지 콜백 실행을 계속합니다.</p>
     *
     * @param reason 취소 사유
     * @return 이번 호출로 취소된 경우 true, 이미 취소되어 있던 경우 false
     */
    public boolean cancel(String reason) {
        List<Runnable> toRun;
        synchronized (this) {
            if (isCancelled()) {
                return false;
            }
            this.reason = reason;
            cancelled.countDown();
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        for (Runnable callback : toRun) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation callback failed for epoch {}", generation, e);
            }
        }
        return true;
    }

    /**
     * 부모 신호에 등록한 콜백 해제.
     *
     * <p>{@link #linked(CancellationSignal...)}로 만든 epoch에서만 의미가 있습니다.</p>
     */
    public void detach() {
        synchronized (parentRegistrations) {
            parentRegistrations.forEach(CancellationRegistration::close);
            parentRegistrations.clear();
        }
    }

    @Override
    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    @Override
    public String getReason() {
        return reason;
    }

    @Override
    public boolean awaitCancellation(long timeoutMs) throws InterruptedException {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must be non-negative (current: " + timeoutMs + ")");
        }
        return cancelled.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public CancellationRegistration onCancel(Runnable callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        synchronized (this) {
            if (!isCancelled()) {
                callbacks.add(callback);
                return () -> callbacks.remove(callback);
            }
        }
        callback.run();
        return CancellationRegistration.EMPTY;
    }

    /**
     * 세대 번호 조회.
     *
     * @return 세대 번호 (linked epoch는 0)
     */
    public long getGeneration() {
        return generation;
    }

    @Override
    public String toString() {
        return "CancellationEpoch{generation=" + generation + ", cancelled=" + isCancelled() + '}';
    }
}
