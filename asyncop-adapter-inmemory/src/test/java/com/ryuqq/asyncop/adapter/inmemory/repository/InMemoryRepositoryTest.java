package com.ryuqq.asyncop.adapter.inmemory.repository;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryRepository 단위 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryRepositoryTest {

    @Test
    void 초기_레코드를_순서대로_반환() throws Exception {
        // given
        InMemoryRepository<String> repository = new InMemoryRepository<>(List.of("b", "a"));

        // when
        List<String> result = repository.fetchAll();

        // then
        assertThat(result).containsExactly("b", "a");
        assertThat(repository.getFetchCount()).isEqualTo(1);
    }

    @Test
    void 조회_결과는_이후_변경에_영향받지_않음() throws Exception {
        // given
        InMemoryRepository<String> repository = new InMemoryRepository<>(List.of("a"));
        List<String> snapshot = repository.fetchAll();

        // when
        repository.add("b");

        // then
        assertThat(snapshot).containsExactly("a");
        assertThat(repository.fetchAll()).containsExactly("a", "b");
    }

    @Test
    void replaceAll은_전체_레코드를_교체() throws Exception {
        // given
        InMemoryRepository<String> repository = new InMemoryRepository<>(List.of("a", "b"));

        // when
        repository.replaceAll(List.of("c"));

        // then
        assertThat(repository.fetchAll()).containsExactly("c");
        assertThat(repository.size()).isEqualTo(1);
    }

    @Test
    void clear_후_빈_목록_반환() throws Exception {
        // given
        InMemoryRepository<String> repository = new InMemoryRepository<>(List.of("a"));

        // when
        repository.clear();

        // then
        assertThat(repository.fetchAll()).isEmpty();
    }

    @Test
    void null_레코드는_거부() {
        InMemoryRepository<String> repository = new InMemoryRepository<>();
        List<String> withNull = new ArrayList<>(Arrays.asList("a", null));

        assertThatThrownBy(() -> repository.add(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("record cannot be null");
        assertThatThrownBy(() -> repository.addAll(withNull))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InMemoryRepository<String>(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(repository.size()).isZero();
    }

    @Test
    void 음수_지연은_거부() {
        InMemoryRepository<String> repository = new InMemoryRepository<>();

        assertThatThrownBy(() -> repository.setFetchLatencyMs(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("fetchLatencyMs must be non-negative");
    }

    @Test
    void 지연_중_인터럽트되면_InterruptedException() throws Exception {
        // given
        InMemoryRepository<String> repository = new InMemoryRepository<>(List.of("a"));
        repository.setFetchLatencyMs(10_000);
        Throwable[] failure = new Throwable[1];
        Thread fetcher = new Thread(() -> {
            try {
                repository.fetchAll();
            } catch (Throwable e) {
                failure[0] = e;
            }
        });

        // when
        fetcher.start();
        Thread.sleep(50);
        fetcher.interrupt();
        fetcher.join(2_000);

        // then
        assertThat(fetcher.isAlive()).isFalse();
        assertThat(failure[0]).isInstanceOf(InterruptedException.class);
    }

    @Test
    void replaceAll_중_동시_조회는_빈_목록을_보지_않음() throws Exception {
        // given
        InMemoryRepository<String> repository = new InMemoryRepository<>(List.of("seed"));
        AtomicBoolean writing = new AtomicBoolean(true);
        AtomicInteger emptyReads = new AtomicInteger();
        Thread reader = new Thread(() -> {
            while (writing.get()) {
                try {
                    if (repository.fetchAll().isEmpty()) {
                        emptyReads.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        });

        // when
        reader.start();
        for (int i = 0; i < 50_000; i++) {
            repository.replaceAll(List.of("v" + i, "w" + i));
        }
        writing.set(false);
        reader.join(5_000);

        // then
        assertThat(emptyReads.get()).isZero();
        assertThat(repository.fetchAll()).containsExactly("v49999", "w49999");
    }

    @Test
    void 여러_스레드의_동시_add가_유실되지_않음() throws Exception {
        // given
        InMemoryRepository<Integer> repository = new InMemoryRepository<>();
        Thread[] writers = new Thread[4];
        for (int t = 0; t < writers.length; t++) {
            int offset = t * 1_000;
            writers[t] = new Thread(() -> {
                for (int i = 0; i < 1_000; i++) {
                    repository.add(offset + i);
                }
            });
        }

        // when
        for (Thread writer : writers) {
            writer.start();
        }
        for (Thread writer : writers) {
            writer.join(5_000);
        }

        // then
        assertThat(repository.size()).isEqualTo(4_000);
        assertThat(repository.fetchAll()).doesNotHaveDuplicates();
    }
}
