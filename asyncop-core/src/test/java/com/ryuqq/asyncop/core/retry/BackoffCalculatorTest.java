package com.ryuqq.asyncop.core.retry;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    @Test
    void 기본값은_500ms에서_두배씩_증가() {
        // given
        BackoffCalculator calculator = new BackoffCalculator();

        // when & then
        assertThat(calculator.calculate(1)).isEqualTo(500);
        assertThat(calculator.calculate(2)).isEqualTo(1000);
        assertThat(calculator.calculate(3)).isEqualTo(2000);
        assertThat(calculator.calculate(4)).isEqualTo(4000);
    }

    @Test
    void 최대_지연시간으로_제한() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(1000, 5000, 0.0);

        // when & then
        assertThat(calculator.calculate(3)).isEqualTo(4000);
        assertThat(calculator.calculate(4)).isEqualTo(5000);
        assertThat(calculator.calculate(100)).isEqualTo(5000);
    }

    @Test
    void jitter_적용시_범위_안의_값() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(1000, 60000, 0.5);

        // when & then
        for (int i = 0; i < 50; i++) {
            long delay = calculator.calculate(2);
            assertThat(delay).isBetween(2000L, 3000L);
        }
    }

    @Test
    void 잘못된_설정은_예외() {
        assertThatThrownBy(() -> new BackoffCalculator(0, 1000, 0.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("baseDelayMs must be positive");
        assertThatThrownBy(() -> new BackoffCalculator(1000, 500, 0.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(500, 1000, 1.5))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 재시도_순번이_양수가_아니면_예외() {
        assertThatThrownBy(() -> new BackoffCalculator().calculate(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
