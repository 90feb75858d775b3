package com.ryuqq.asyncop.adapter.inmemory.error;

import com.ryuqq.asyncop.core.spi.ErrorReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link ErrorReporter} SPI that keeps every report.
 *
 * <p>Stands in for a user-facing error dialog in headless runs and tests: callers can
 * inspect what would have been shown to the user after an operation failed.</p>
 *
 * <p>Thread-safe. Reports may arrive from any worker thread.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CollectingErrorReporter implements ErrorReporter {

    private static final Logger log = LoggerFactory.getLogger(CollectingErrorReporter.class);

    private final List<ErrorReport> reports = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public CollectingErrorReporter() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock clock used for {@link ErrorReport#occurredAt()}
     * @throws IllegalArgumentException if clock is null
     */
    public CollectingErrorReporter(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public void reportError(String context, Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        ErrorReport report = new ErrorReport(context == null ? "" : context, error, clock.instant());
        reports.add(report);
        log.debug("Collected error report for '{}': {}", report.context(), error.getMessage());
    }

    /**
     * @return immutable snapshot of reports in arrival order
     */
    public List<ErrorReport> getReports() {
        return List.copyOf(reports);
    }

    public Optional<ErrorReport> getLastReport() {
        List<ErrorReport> snapshot = getReports();
        return snapshot.isEmpty() ? Optional.empty() : Optional.of(snapshot.get(snapshot.size() - 1));
    }

    public int size() {
        return reports.size();
    }

    public void clear() {
        reports.clear();
    }

    /**
     * A single error report.
     *
     * @param context failed operation description
     * @param error reported exception
     * @param occurredAt time the report was received
     */
    public record ErrorReport(String context, Throwable error, Instant occurredAt) {

        public ErrorReport {
            if (context == null) {
                throw new IllegalArgumentException("context cannot be null");
            }
            if (error == null) {
                throw new IllegalArgumentException("error cannot be null");
            }
            if (occurredAt == null) {
                throw new IllegalArgumentException("occurredAt cannot be null");
            }
        }
    }
}
