/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.catchup;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import io.syncbase.annotation.Immutable;

/**
 * A row read back from a table together with its creation and last modification times.
 */
@Immutable
public final class HistoricalRow {

    private final Map<String, Object> columns;
    private final Instant createdAt;
    private final Instant modifiedAt;

    public HistoricalRow(Map<String, Object> columns, Instant createdAt, Instant modifiedAt) {
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(columns)));
        this.createdAt = createdAt;
        this.modifiedAt = modifiedAt;
    }

    public Map<String, Object> columns() {
        return columns;
    }

    /**
     * @return the creation time, or null if the row has none
     */
    public Instant createdAt() {
        return createdAt;
    }

    /**
     * @return the last modification time, or null if the row was never modified after creation
     */
    public Instant modifiedAt() {
        return modifiedAt;
    }

    /**
     * @return the modification time, falling back to the creation time; may be null if the row has neither
     */
    public Instant changedAt() {
        return modifiedAt != null ? modifiedAt : createdAt;
    }

    @Override
    public String toString() {
        return "HistoricalRow{createdAt=" + createdAt + ", modifiedAt=" + modifiedAt + ", columns=" + columns + "}";
    }
}
