package com.ryuqq.asyncop.testkit.fake;

import com.ryuqq.asyncop.core.spi.Repository;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link #release()}가 호출될 때까지 fetchAll을 멈춰 두는 Repository.
 *
 * <p>load가 진행 중인 상태를 재현하여 중복 요청, 취소, 제한 시간 시나리오를 검증할 때 사용합니다.</p>
 *
 * @param <T> 항목 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BlockingRepository<T> implements Repository<T> {

    private static final long MAX_BLOCK_SECONDS = 30;

    private final List<T> items;
    private final CountDownLatch entered = new CountDownLatch(1);
    private final CountDownLatch released = new CountDownLatch(1);
    private final AtomicInteger calls = new AtomicInteger();

    public BlockingRepository(List<T> items) {
        this.items = List.copyOf(items);
    }

    @Override
    public List<T> fetchAll() throws InterruptedException {
        calls.incrementAndGet();
        entered.countDown();
        if (!released.await(MAX_BLOCK_SECONDS, TimeUnit.SECONDS)) {
            throw new IllegalStateException("BlockingRepository was never released");
        }
        return items;
    }

    /**
     * fetchAll 진입 대기.
     *
     * @param timeoutMs 최대 대기 시간
     * @return 진입한 경우 true
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public boolean awaitEntered(long timeoutMs) throws InterruptedException {
        return entered.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    public void release() {
        released.countDown();
    }

    public int getCallCount() {
        return calls.get();
    }
}
