package com.ryuqq.asyncop.testkit.fake;

import com.ryuqq.asyncop.core.spi.Repository;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 처음 N번은 일시 오류로 실패하고 이후 고정 항목을 반환하는 Repository.
 *
 * @param <T> 항목 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FlakyRepository<T> implements Repository<T> {

    private final int failuresBeforeSuccess;
    private final List<T> items;
    private final AtomicInteger calls = new AtomicInteger();

    /**
     * @param failuresBeforeSuccess 성공 전 실패 횟수 (Integer.MAX_VALUE면 항상 실패)
     * @param items 성공 시 반환할 항목
     */
    public FlakyRepository(int failuresBeforeSuccess, List<T> items) {
        if (failuresBeforeSuccess < 0) {
            throw new IllegalArgumentException(
                "failuresBeforeSuccess must be non-negative (current: " + failuresBeforeSuccess + ")");
        }
        this.failuresBeforeSuccess = failuresBeforeSuccess;
        this.items = List.copyOf(items);
    }

    public static <T> FlakyRepository<T> alwaysFailing() {
        return new FlakyRepository<>(Integer.MAX_VALUE, List.of());
    }

    @Override
    public List<T> fetchAll() throws IOException {
        int call = calls.incrementAndGet();
        if (call <= failuresBeforeSuccess) {
            throw new IOException("Transient failure #" + call);
        }
        return items;
    }

    public int getCallCount() {
        return calls.get();
    }
}
