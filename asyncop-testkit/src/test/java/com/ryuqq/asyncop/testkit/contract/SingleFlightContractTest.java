package com.ryuqq.asyncop.testkit.contract;

import ch.qos.logback.classic.Level;
import com.ryuqq.asyncop.application.loader.CollectionLoader;
import com.ryuqq.asyncop.core.outcome.LoadOutcome;
import com.ryuqq.asyncop.testkit.fake.BlockingRepository;
import com.ryuqq.asyncop.testkit.logging.LogCapture;
import org.junit.jupiter.api.Test;

import java.beans.PropertyChangeEvent;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Single-flight guarded load.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Back-to-back loads while the first is in flight → exactly one repository call</li>
 *   <li>The duplicate returns immediately, logged as a duplicate-skip</li>
 *   <li>The duplicate mutates no progress state</li>
 *   <li>The guard is released after the first load, so a later load runs again</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SingleFlightContractTest extends AbstractContractTest {

    @Test
    void testSingleFlight_BackToBackLoads_ExactlyOneRepositoryCall() throws Exception {
        // Given
        BlockingRepository<String> repository = new BlockingRepository<>(List.of("a", "b"));
        CollectionLoader<String> loader = newLoader(repository, fastConfig(3));

        try (LogCapture capture = LogCapture.attach(CollectionLoader.class)) {
            // When
            CompletableFuture<LoadOutcome> first = loader.loadAsync();
            assertTrue(repository.awaitEntered(2_000));
            LoadOutcome second = loader.load();
            repository.release();

            // Then
            assertTrue(second.isSkipped());
            assertTrue(first.get(5, TimeUnit.SECONDS).isLoaded());
            assertEquals(1, repository.getCallCount());
            assertTrue(capture.messages(Level.INFO).stream()
                .anyMatch(message -> message.contains("skipping duplicate request")));
        }
    }

    @Test
    void testSingleFlight_Duplicate_NoProgressStateMutation() throws Exception {
        // Given
        BlockingRepository<String> repository = new BlockingRepository<>(List.of("a"));
        CollectionLoader<String> loader = newLoader(repository, fastConfig(3));
        CompletableFuture<LoadOutcome> first = loader.loadAsync();
        assertTrue(repository.awaitEntered(2_000));

        List<PropertyChangeEvent> mutations = new CopyOnWriteArrayList<>();
        executor.getState().addPropertyChangeListener(mutations::add);
        tracker.addPropertyChangeListener(mutations::add);
        tracker.getReporter().addPropertyChangeListener(mutations::add);

        // When
        LoadOutcome duplicate = loader.load();

        // Then
        assertTrue(duplicate.isSkipped());
        assertTrue(mutations.isEmpty(), "Duplicate load should not touch state but saw " + mutations);

        repository.release();
        first.get(5, TimeUnit.SECONDS);
    }

    @Test
    void testSingleFlight_AfterCompletion_LoadRunsAgain() {
        // Given
        CollectionLoader<String> loader = newLoader(createRepository(List.of("x")), fastConfig(0));

        // When
        LoadOutcome first = loader.load();
        LoadOutcome second = loader.load();

        // Then
        assertTrue(first.isLoaded());
        assertTrue(second.isLoaded());
        assertFalse(loader.isLoading());
    }
}
