/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.catchup;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.syncbase.annotation.ThreadSafe;
import io.syncbase.data.ChangeEvent;
import io.syncbase.data.Operation;
import io.syncbase.util.Clock;

/**
 * Replays the changes of a table from its current state.
 * <p>
 * A row changed after the watermark is reported as an {@link Operation#INSERT} when it was also created after the
 * watermark, and as an {@link Operation#UPDATE} otherwise. Deleted rows are no longer in the table, so deletes cannot be
 * replayed.
 *
 * @author Syncbase Authors
 */
@ThreadSafe
public class CatchUpReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(CatchUpReader.class);

    private final HistoricalStore store;
    private final Clock clock;
    private final Duration lookback;
    private final int maxRows;

    public CatchUpReader(HistoricalStore store, Clock clock, Duration lookback, int maxRows) {
        this.store = Objects.requireNonNull(store);
        this.clock = Objects.requireNonNull(clock);
        this.lookback = Objects.requireNonNull(lookback);
        if (maxRows <= 0) {
            throw new IllegalArgumentException("The maximum number of catch-up rows must be positive");
        }
        this.maxRows = maxRows;
    }

    /**
     * Read the rows of a table changed after the watermark.
     *
     * @param table the table; may not be null
     * @param watermark the exclusive lower bound; may not be null
     * @param limit the maximum number of events; must be positive
     * @return the lazy sequence of events; never null
     */
    public CatchUpSequence readSince(String table, Instant watermark, int limit) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(watermark, "watermark");
        if (limit <= 0) {
            throw new IllegalArgumentException("The limit must be positive but was " + limit);
        }
        return new CatchUpSequence(table, watermark, limit, () -> read(table, watermark, limit));
    }

    /**
     * Read the changes of a table since the last synchronization, or within the look-back window when the table was never
     * synchronized.
     *
     * @param table the table; may not be null
     * @param lastSyncTime the last synchronization time; may be null
     * @return the lazy sequence of events; never null
     */
    public CatchUpSequence performInitialSync(String table, Instant lastSyncTime) {
        final Instant since = lastSyncTime != null ? lastSyncTime : clock.currentTimeAsInstant().minus(lookback);
        LOGGER.info("Preparing initial sync of '{}' from {}", table, since);
        return readSince(table, since, maxRows);
    }

    /**
     * Abort any read in progress.
     */
    public void cancel() {
        store.cancel();
    }

    private Iterator<ChangeEvent> read(String table, Instant watermark, int limit) {
        final List<HistoricalRow> rows = store.fetchChangedSince(table, watermark, limit);
        LOGGER.info("Read {} changed rows of '{}' since {}", rows.size(), table, watermark);
        final Instant observedAt = clock.currentTimeAsInstant();
        return rows.stream()
                .limit(limit)
                .map(row -> toEvent(table, watermark, observedAt, row))
                .collect(Collectors.toList())
                .iterator();
    }

    static ChangeEvent toEvent(String table, Instant watermark, Instant observedAt, HistoricalRow row) {
        final boolean created = row.createdAt() != null && row.createdAt().isAfter(watermark);
        return ChangeEvent.create()
                .table(table)
                .operation(created ? Operation.INSERT : Operation.UPDATE)
                .record(row.columns())
                .observedAt(observedAt)
                .sourceCommitTime(row.changedAt())
                .build();
    }
}
