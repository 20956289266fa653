/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.catchup;

import java.time.Instant;
import java.util.Iterator;
import java.util.function.Supplier;

import io.syncbase.data.ChangeEvent;

/**
 * The result of a catch-up read: a finite sequence of change events in ascending change order.
 * <p>
 * Nothing is read until {@link #iterator()} is called. Every call to {@code iterator()} reads the source again, so the
 * sequence can be traversed more than once and reflects the source at the time of each traversal.
 */
public final class CatchUpSequence implements Iterable<ChangeEvent> {

    private final String table;
    private final Instant watermark;
    private final int limit;
    private final Supplier<Iterator<ChangeEvent>> reader;

    CatchUpSequence(String table, Instant watermark, int limit, Supplier<Iterator<ChangeEvent>> reader) {
        this.table = table;
        this.watermark = watermark;
        this.limit = limit;
        this.reader = reader;
    }

    public String table() {
        return table;
    }

    public Instant watermark() {
        return watermark;
    }

    public int limit() {
        return limit;
    }

    @Override
    public Iterator<ChangeEvent> iterator() {
        return reader.get();
    }

    @Override
    public String toString() {
        return "CatchUpSequence{table='" + table + "', watermark=" + watermark + ", limit=" + limit + "}";
    }
}
