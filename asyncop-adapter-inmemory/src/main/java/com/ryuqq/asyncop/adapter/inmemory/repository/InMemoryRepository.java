package com.ryuqq.asyncop.adapter.inmemory.repository;

import com.ryuqq.asyncop.core.spi.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link Repository} SPI for testing and reference purposes.
 *
 * <p>Records are kept as an immutable snapshot that writers swap in a single volatile write,
 * so {@link #fetchAll()} always returns a complete snapshot even while other threads add or
 * replace records. Writers are serialized on the repository monitor.</p>
 *
 * <p>An optional fetch latency simulates a slow backing store. The latency wait honours
 * thread interruption, which lets timeout and cancellation paths be exercised without
 * a real database.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryRepository&lt;Enterprise&gt; repository = new InMemoryRepository&lt;&gt;(List.of(acme, globex));
 * repository.setFetchLatencyMs(200);
 *
 * CollectionLoader&lt;Enterprise&gt; loader = new CollectionLoader&lt;&gt;(
 *     "Enterprises", repository, enterprises, executor, tracker, new LoaderConfig());
 * </pre>
 *
 * @param <T> record type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryRepository<T> implements Repository<T> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRepository.class);

    private volatile List<T> records = List.of();
    private final AtomicInteger fetchCount = new AtomicInteger();
    private volatile long fetchLatencyMs;

    /**
     * Creates an empty repository.
     */
    public InMemoryRepository() {
        this(List.of());
    }

    /**
     * Creates a repository seeded with the given records.
     *
     * @param initialRecords initial records (no null elements)
     * @throws IllegalArgumentException if initialRecords is null or contains null
     */
    public InMemoryRepository(Collection<? extends T> initialRecords) {
        addAll(initialRecords);
    }

    @Override
    public List<T> fetchAll() throws InterruptedException {
        int call = fetchCount.incrementAndGet();
        long latency = fetchLatencyMs;
        if (latency > 0) {
            TimeUnit.MILLISECONDS.sleep(latency);
        }
        List<T> snapshot = records;
        log.debug("Fetch #{} returned {} records", call, snapshot.size());
        return snapshot;
    }

    /**
     * Appends a record.
     *
     * @param record record to add
     * @throws IllegalArgumentException if record is null
     */
    public void add(T record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        addAll(List.of(record));
    }

    /**
     * Appends all records in order.
     *
     * @param newRecords records to add
     * @throws IllegalArgumentException if newRecords is null or contains null
     */
    public void addAll(Collection<? extends T> newRecords) {
        List<T> additions = validated(newRecords);
        synchronized (this) {
            List<T> next = new ArrayList<>(records.size() + additions.size());
            next.addAll(records);
            next.addAll(additions);
            records = List.copyOf(next);
        }
    }

    /**
     * Replaces all records atomically.
     *
     * @param newRecords replacement records
     * @throws IllegalArgumentException if newRecords is null or contains null
     */
    public void replaceAll(Collection<? extends T> newRecords) {
        List<T> copy = validated(newRecords);
        synchronized (this) {
            records = copy;
        }
    }

    /**
     * Removes all records.
     */
    public synchronized void clear() {
        records = List.of();
    }

    /**
     * @return current record count
     */
    public int size() {
        return records.size();
    }

    /**
     * @return number of {@link #fetchAll()} calls so far
     */
    public int getFetchCount() {
        return fetchCount.get();
    }

    /**
     * Sets the simulated fetch latency.
     *
     * @param fetchLatencyMs latency in milliseconds (0 disables)
     * @throws IllegalArgumentException if fetchLatencyMs is negative
     */
    public void setFetchLatencyMs(long fetchLatencyMs) {
        if (fetchLatencyMs < 0) {
            throw new IllegalArgumentException(
                "fetchLatencyMs must be non-negative (current: " + fetchLatencyMs + ")"
            );
        }
        this.fetchLatencyMs = fetchLatencyMs;
    }

    public long getFetchLatencyMs() {
        return fetchLatencyMs;
    }

    private List<T> validated(Collection<? extends T> newRecords) {
        if (newRecords == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        for (T record : newRecords) {
            if (record == null) {
                throw new IllegalArgumentException("records cannot contain null");
            }
        }
        return List.copyOf(newRecords);
    }
}
