package com.ryuqq.asyncop.core.cancellation;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 현재 취소 epoch를 소유하고 교체하는 컴포넌트.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>{@link #current()}: 현재 epoch 반환 (Operation 시작 시 캡처)</li>
 *   <li>{@link #cancel()}: 현재 epoch 취소</li>
 *   <li>{@link #reset()}: 새 epoch로 교체한 뒤 이전 epoch를 취소</li>
 *   <li>{@link #close()}: 현재 epoch를 취소하고 이후 호출을 즉시 실패시킴</li>
 * </ul>
 *
 * <p>reset은 교체를 먼저 수행하므로, reset 이후 시작된 Operation은 항상 새 epoch를 받습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CancellationSource implements AutoCloseable {

    private final AtomicReference<CancellationEpoch> current = new AtomicReference<>(CancellationEpoch.first());
    private volatile boolean disposed;

    /**
     * 현재 epoch 조회.
     *
     * @return 현재 취소 신호
     * @throws IllegalStateException 이미 dispose된 경우
     */
    public CancellationEpoch current() {
        ensureNotDisposed();
        return current.get();
    }

    /**
     * 현재 epoch 취소.
     *
     * @return 이번 호출로 취소된 경우 true
     */
    public boolean cancel() {
        return current.get().cancel("cancellation requested");
    }

    /**
     * 현재 epoch를 무효화하고 새 epoch 발급.
     *
     * @return 새로 발급된 epoch
     * @throws IllegalStateException 이미 dispose된 경우
     */
    public CancellationEpoch reset() {
        ensureNotDisposed();
        CancellationEpoch previous;
        CancellationEpoch next;
        do {
            previous = current.get();
            next = previous.next();
        } while (!current.compareAndSet(previous, next));

        previous.cancel("cancellation epoch reset");
        return next;
    }

    /**
     * dispose 여부 확인.
     *
     * @return dispose된 경우 true
     */
    public boolean isDisposed() {
        return disposed;
    }

    /**
     * dispose: 현재 epoch 취소 후 이후 호출을 거부.
     */
    @Override
    public void close() {
        disposed = true;
        current.get().cancel("cancellation source disposed");
    }

    private void ensureNotDisposed() {
        if (disposed) {
            throw new IllegalStateException("CancellationSource has been disposed");
        }
    }
}
