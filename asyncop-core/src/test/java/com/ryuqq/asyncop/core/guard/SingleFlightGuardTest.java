package com.ryuqq.asyncop.core.guard;

import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SingleFlightGuard 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SingleFlightGuardTest {

    @Test
    void tryEnter_진입중이면_false() {
        // given
        SingleFlightGuard guard = new SingleFlightGuard("load");

        // when
        boolean first = guard.tryEnter();
        boolean second = guard.tryEnter();

        // then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(guard.isInFlight()).isTrue();
    }

    @Test
    void release_후_다시_진입_가능() {
        // given
        SingleFlightGuard guard = new SingleFlightGuard("load");
        guard.tryEnter();

        // when
        guard.release();

        // then
        assertThat(guard.isInFlight()).isFalse();
        assertThat(guard.tryEnter()).isTrue();
    }

    @Test
    void 진입없이_release하면_예외() {
        // given
        SingleFlightGuard guard = new SingleFlightGuard("load");

        // when & then
        assertThatThrownBy(guard::release)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("load");
    }

    @Test
    void tryAcquire_permit_close로_해제() {
        // given
        SingleFlightGuard guard = new SingleFlightGuard("load");

        // when
        try (SingleFlightGuard.Permit permit = guard.tryAcquire().orElseThrow()) {
            assertThat(guard.tryAcquire()).isEmpty();
        }

        // then
        assertThat(guard.isInFlight()).isFalse();
    }

    @Test
    void permit_close_여러번_호출해도_한번만_해제() {
        // given
        SingleFlightGuard guard = new SingleFlightGuard("load");
        SingleFlightGuard.Permit permit = guard.tryAcquire().orElseThrow();

        // when
        permit.close();
        Optional<SingleFlightGuard.Permit> next = guard.tryAcquire();
        permit.close();

        // then
        assertThat(next).isPresent();
        assertThat(guard.isInFlight()).isTrue();
    }

    @Test
    void 동시_진입시_하나만_성공() throws InterruptedException {
        // given
        SingleFlightGuard guard = new SingleFlightGuard("load");
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger entered = new AtomicInteger();

        // when
        for (int i = 0; i < threads; i++) {
            pool.execute(() -> {
                try {
                    start.await();
                    if (guard.tryEnter()) {
                        entered.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        done.await(5, TimeUnit.SECONDS);
        pool.shutdownNow();

        // then
        assertThat(entered.get()).isEqualTo(1);
    }

    @Test
    void 이름이_비어있으면_예외() {
        assertThatThrownBy(() -> new SingleFlightGuard(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
