package com.ryuqq.asyncop.core.cancellation;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CancellationEpoch 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CancellationEpochTest {

    @Test
    void cancel_최초_호출만_true_반환() {
        // given
        CancellationEpoch epoch = CancellationEpoch.first();

        // when
        boolean first = epoch.cancel("first");
        boolean second = epoch.cancel("second");

        // then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(epoch.isCancelled()).isTrue();
        assertThat(epoch.getReason()).isEqualTo("first");
    }

    @Test
    void onCancel_콜백은_한번만_실행() {
        // given
        CancellationEpoch epoch = CancellationEpoch.first();
        AtomicInteger calls = new AtomicInteger();
        epoch.onCancel(calls::incrementAndGet);

        // when
        epoch.cancel("stop");
        epoch.cancel("stop again");

        // then
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void onCancel_이미_취소된_경우_즉시_실행() {
        // given
        CancellationEpoch epoch = CancellationEpoch.first();
        epoch.cancel("done");
        AtomicInteger calls = new AtomicInteger();

        // when
        CancellationRegistration registration = epoch.onCancel(calls::incrementAndGet);

        // then
        assertThat(calls.get()).isEqualTo(1);
        assertThat(registration).isSameAs(CancellationRegistration.EMPTY);
    }

    @Test
    void onCancel_등록_해제_후_콜백_미실행() {
        // given
        CancellationEpoch epoch = CancellationEpoch.first();
        AtomicInteger calls = new AtomicInteger();
        CancellationRegistration registration = epoch.onCancel(calls::incrementAndGet);

        // when
        registration.close();
        epoch.cancel("stop");

        // then
        assertThat(calls.get()).isZero();
    }

    @Test
    void 콜백_예외가_나머지_콜백을_막지_않음() {
        // given
        CancellationEpoch epoch = CancellationEpoch.first();
        AtomicInteger calls = new AtomicInteger();
        epoch.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        epoch.onCancel(calls::incrementAndGet);

        // when
        epoch.cancel("stop");

        // then
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void linked_부모_취소시_자식도_취소() {
        // given
        CancellationEpoch parentA = CancellationEpoch.first();
        CancellationEpoch parentB = CancellationEpoch.first();
        CancellationEpoch child = CancellationEpoch.linked(parentA, parentB);

        // when
        parentB.cancel("user");

        // then
        assertThat(child.isCancelled()).isTrue();
        assertThat(child.getReason()).contains("user");
        assertThat(parentA.isCancelled()).isFalse();
    }

    @Test
    void linked_이미_취소된_부모면_즉시_취소() {
        // given
        CancellationEpoch parent = CancellationEpoch.first();
        parent.cancel("earlier");

        // when
        CancellationEpoch child = CancellationEpoch.linked(parent);

        // then
        assertThat(child.isCancelled()).isTrue();
        assertThat(child.getGeneration()).isZero();
    }

    @Test
    void linked_detach_후_부모_취소_전파_안됨() {
        // given
        CancellationEpoch parent = CancellationEpoch.first();
        CancellationEpoch child = CancellationEpoch.linked(parent);

        // when
        child.detach();
        parent.cancel("late");

        // then
        assertThat(child.isCancelled()).isFalse();
    }

    @Test
    void linked_부모_없으면_예외() {
        assertThatThrownBy(CancellationEpoch::linked)
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void awaitCancellation_취소되면_즉시_true() throws InterruptedException {
        // given
        CancellationEpoch epoch = CancellationEpoch.first();
        epoch.cancel("now");

        // when
        long start = System.nanoTime();
        boolean cancelled = epoch.awaitCancellation(5_000);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        // then
        assertThat(cancelled).isTrue();
        assertThat(elapsedMs).isLessThan(1_000);
    }

    @Test
    void awaitCancellation_시간_경과시_false() throws InterruptedException {
        // given
        CancellationEpoch epoch = CancellationEpoch.first();

        // when & then
        assertThat(epoch.awaitCancellation(20)).isFalse();
    }
}
