/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.transport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.syncbase.annotation.Immutable;

/**
 * A change as published by the transport, before it is validated and translated into a
 * {@link io.syncbase.data.ChangeEvent}.
 */
@Immutable
public final class RealtimeChange {

    private final String eventType;
    private final String schema;
    private final String table;
    private final Map<String, Object> newRecord;
    private final Map<String, Object> oldRecord;
    private final String commitTimestamp;
    private final boolean truncated;

    public RealtimeChange(String eventType, String schema, String table, Map<String, Object> newRecord,
                          Map<String, Object> oldRecord, String commitTimestamp) {
        this(eventType, schema, table, newRecord, oldRecord, commitTimestamp, false);
    }

    public RealtimeChange(String eventType, String schema, String table, Map<String, Object> newRecord,
                          Map<String, Object> oldRecord, String commitTimestamp, boolean truncated) {
        this.eventType = eventType;
        this.schema = schema;
        this.table = table;
        this.newRecord = copyOf(newRecord);
        this.oldRecord = copyOf(oldRecord);
        this.commitTimestamp = commitTimestamp;
        this.truncated = truncated;
    }

    private static Map<String, Object> copyOf(Map<String, Object> image) {
        if (image == null || image.isEmpty()) {
            return null;
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(image));
    }

    /**
     * @return the operation as named by the source, e.g. {@code INSERT}; may be null
     */
    public String eventType() {
        return eventType;
    }

    public String schema() {
        return schema;
    }

    public String table() {
        return table;
    }

    /**
     * @return the row after the change, or null when absent or empty
     */
    public Map<String, Object> newRecord() {
        return newRecord;
    }

    /**
     * @return the row before the change, or null when absent or empty
     */
    public Map<String, Object> oldRecord() {
        return oldRecord;
    }

    public String commitTimestamp() {
        return commitTimestamp;
    }

    /**
     * @return true if the source could not publish the full row images, in which case they carry only the key column
     */
    public boolean isTruncated() {
        return truncated;
    }

    @Override
    public String toString() {
        return "RealtimeChange{eventType=" + eventType + ", table=" + schema + "." + table + ", commitTimestamp=" + commitTimestamp
                + (truncated ? ", truncated" : "") + "}";
    }
}
