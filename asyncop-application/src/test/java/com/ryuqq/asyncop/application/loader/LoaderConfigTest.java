package com.ryuqq.asyncop.application.loader;

import com.ryuqq.asyncop.core.retry.BackoffCalculator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LoaderConfig 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class LoaderConfigTest {

    @Test
    void 기본값() {
        // when
        LoaderConfig config = new LoaderConfig();

        // then
        assertThat(config.maxRetries()).isEqualTo(3);
        assertThat(config.baseDelayMs()).isEqualTo(500);
        assertThat(config.maxDelayMs()).isEqualTo(30000);
        assertThat(config.jitterFactor()).isZero();
        assertThat(config.timeoutMs()).isEqualTo(30000);
    }

    @Test
    void with_메서드는_해당_값만_변경() {
        // given
        LoaderConfig config = new LoaderConfig();

        // when
        LoaderConfig changed = config.withMaxRetries(5).withTimeoutMs(1000);

        // then
        assertThat(changed.maxRetries()).isEqualTo(5);
        assertThat(changed.timeoutMs()).isEqualTo(1000);
        assertThat(changed.baseDelayMs()).isEqualTo(config.baseDelayMs());
        assertThat(config.maxRetries()).isEqualTo(3);
    }

    @Test
    void BackoffCalculator_변환() {
        // when
        BackoffCalculator calculator = new LoaderConfig().withBaseDelayMs(100).toBackoffCalculator();

        // then
        assertThat(calculator.calculate(1)).isEqualTo(100);
        assertThat(calculator.calculate(3)).isEqualTo(400);
    }

    @Test
    void 잘못된_값은_예외() {
        assertThatThrownBy(() -> new LoaderConfig().withMaxRetries(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxRetries must be non-negative");
        assertThatThrownBy(() -> new LoaderConfig().withTimeoutMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("timeoutMs must be positive");
        assertThatThrownBy(() -> new LoaderConfig().withMaxDelayMs(100))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LoaderConfig().withJitterFactor(2.0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
