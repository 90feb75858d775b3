package com.ryuqq.asyncop.adapter.inmemory.repository;

import com.ryuqq.asyncop.adapter.inmemory.error.CollectingErrorReporter;
import com.ryuqq.asyncop.application.executor.AsyncOperationExecutor;
import com.ryuqq.asyncop.application.loader.CollectionLoader;
import com.ryuqq.asyncop.core.outcome.LoadOutcome;
import com.ryuqq.asyncop.core.outcome.Loaded;
import com.ryuqq.asyncop.core.outcome.TimedOut;
import com.ryuqq.asyncop.core.spi.Repository;
import com.ryuqq.asyncop.testkit.contract.AbstractContractTest;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Tests for InMemoryRepository implementation.
 *
 * <p>This test class validates that {@link InMemoryRepository} behaves as a
 * {@link Repository} the collection loader can rely on.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Seeded records → loaded in order into the UI collection</li>
 *   <li>Records changed between loads → next load reflects the change</li>
 *   <li>Fetch latency above the timeout → TimedOut, previous content kept</li>
 *   <li>Duplicate load during a slow fetch → only one fetch</li>
 *   <li>Failing load → error reported through the ErrorReporter</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryRepositoryContractTest extends AbstractContractTest {

    @Override
    protected Repository<String> createRepository(List<String> items) {
        return new InMemoryRepository<>(items);
    }

    @Test
    void testLoad_SeededRecords_LoadedInOrder() {
        // Given
        CollectionLoader<String> loader = newLoader(createRepository(List.of("c", "a", "b")), fastConfig(1));

        // When
        LoadOutcome outcome = loader.load();

        // Then
        assertEquals(new Loaded(3, false), outcome);
        assertCollectionEquals(List.of("c", "a", "b"));
        assertIdleState();
    }

    @Test
    void testLoad_RecordsChangedBetweenLoads_NextLoadReflectsChange() {
        // Given
        InMemoryRepository<String> repository = new InMemoryRepository<>(List.of("old"));
        CollectionLoader<String> loader = newLoader(repository, fastConfig(1));
        loader.load();

        // When
        repository.replaceAll(List.of("new-1", "new-2"));
        loader.load();

        // Then
        assertCollectionEquals(List.of("new-1", "new-2"));
        assertEquals(2, repository.getFetchCount());
    }

    @Test
    void testLoad_LatencyAboveTimeout_TimedOut() {
        // Given
        InMemoryRepository<String> repository = new InMemoryRepository<>(List.of("slow"));
        repository.setFetchLatencyMs(3_000);
        CollectionLoader<String> loader = newLoader(repository, fastConfig(0).withTimeoutMs(100));

        // When
        LoadOutcome outcome = loader.load();

        // Then
        assertEquals(new TimedOut(100), outcome);
        assertTrue(collection.isEmpty());
        assertIdleState();
    }

    @Test
    void testLoad_DuplicateDuringSlowFetch_SingleFetch() throws Exception {
        // Given
        InMemoryRepository<String> repository = new InMemoryRepository<>(List.of("x"));
        repository.setFetchLatencyMs(300);
        CollectionLoader<String> loader = newLoader(repository, fastConfig(0));

        // When
        CompletableFuture<LoadOutcome> first = loader.loadAsync();
        while (!loader.isLoading()) {
            Thread.sleep(5);
        }
        LoadOutcome second = loader.load();

        // Then
        assertTrue(second.isSkipped());
        assertTrue(first.get().isLoaded());
        assertEquals(1, repository.getFetchCount());
    }

    @Test
    void testLoad_FetchFails_ErrorReported() {
        // Given
        CollectingErrorReporter reporter = new CollectingErrorReporter();
        executor.close();
        executor = new AsyncOperationExecutor(
            LoggerFactory.getLogger(AsyncOperationExecutor.class), reporter, worker);
        Repository<String> failing = () -> {
            throw new IllegalStateException("connection refused");
        };
        CollectionLoader<String> loader = newLoader(failing, fastConfig(1));

        // When
        LoadOutcome outcome = loader.load();

        // Then
        assertTrue(outcome.isFailed());
        assertEquals(1, reporter.size());
        assertEquals("Items load", reporter.getLastReport().orElseThrow().context());
        assertIdleState();
    }
}
