/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.catchup;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * A {@link HistoricalStore} over rows held in memory, filtering and ordering them like the JDBC store does.
 */
public class InMemoryHistoricalStore implements HistoricalStore {

    private final Map<String, List<HistoricalRow>> rowsByTable = new ConcurrentHashMap<>();
    private final AtomicInteger fetches = new AtomicInteger();
    private final AtomicInteger cancels = new AtomicInteger();

    public InMemoryHistoricalStore add(String table, Map<String, Object> columns, Instant createdAt, Instant modifiedAt) {
        rowsByTable.computeIfAbsent(table, t -> new CopyOnWriteArrayList<>()).add(new HistoricalRow(columns, createdAt, modifiedAt));
        return this;
    }

    @Override
    public List<HistoricalRow> fetchChangedSince(String table, Instant watermark, int limit) {
        fetches.incrementAndGet();
        return rowsByTable.getOrDefault(table, new ArrayList<>()).stream()
                .filter(row -> isAfter(row.modifiedAt(), watermark) || isAfter(row.createdAt(), watermark))
                .sorted(Comparator.comparing(HistoricalRow::changedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .limit(limit)
                .collect(Collectors.toList());
    }

    private static boolean isAfter(Instant time, Instant watermark) {
        return time != null && time.isAfter(watermark);
    }

    @Override
    public void cancel() {
        cancels.incrementAndGet();
    }

    public int fetches() {
        return fetches.get();
    }

    public int cancels() {
        return cancels.get();
    }
}
