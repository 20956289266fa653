/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.data;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single row-level change observed on a watched table.
 * <p>
 * The {@link #record() record} is the row's post-image for inserts and updates. For deletes it holds the last known
 * state of the row (the pre-image, or at least its identifying columns), so a delete is never without a record.
 * <p>
 * Instances are immutable; the row images are copied and exposed as unmodifiable maps. Values inside the
 * maps are kept as received from the source.
 *
 * @author Syncbase Authors
 */
public final class ChangeEvent {

    private final String table;
    private final Operation operation;
    private final Map<String, Object> record;
    private final Map<String, Object> previousRecord;
    private final Instant observedAt;
    private final Instant sourceCommitTime;

    private ChangeEvent(Builder builder) {
        this.table = Objects.requireNonNull(builder.table, "table must not be null");
        this.operation = Objects.requireNonNull(builder.operation, "operation must not be null");
        this.observedAt = Objects.requireNonNull(builder.observedAt, "observedAt must not be null");
        this.previousRecord = builder.previousRecord == null ? null : copy(builder.previousRecord);
        Map<String, Object> image = builder.record;
        if (image == null && operation == Operation.DELETE) {
            image = builder.previousRecord;
        }
        if (image == null) {
            throw new IllegalArgumentException("A " + operation + " event on '" + table + "' requires a record image");
        }
        this.record = copy(image);
        this.sourceCommitTime = builder.sourceCommitTime;
    }

    private static Map<String, Object> copy(Map<String, Object> image) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(image));
    }

    public static Builder create() {
        return new Builder();
    }

    public String table() {
        return table;
    }

    public Operation operation() {
        return operation;
    }

    /**
     * @return the post-image, or for deletes the last known state of the row; never null
     */
    public Map<String, Object> record() {
        return record;
    }

    /**
     * @return the pre-image of the row, when the source supplied one
     */
    public Optional<Map<String, Object>> previousRecord() {
        return Optional.ofNullable(previousRecord);
    }

    /**
     * @return the local time at which the event was received; never null
     */
    public Instant observedAt() {
        return observedAt;
    }

    /**
     * @return the commit time reported by the source, when known
     */
    public Optional<Instant> sourceCommitTime() {
        return Optional.ofNullable(sourceCommitTime);
    }

    /**
     * Build a key that identifies this change, so that a sink can recognize events it has already applied when a batch
     * is redelivered or when the live and catch-up paths report the same change.
     *
     * @param keyColumn the name of the primary key column; may not be null
     * @return the key combining table, primary key value, operation and commit time; never null
     */
    public String idempotencyKey(String keyColumn) {
        final Object key = record.get(keyColumn);
        return table + ':' + key + ':' + operation.code() + ':' + (sourceCommitTime == null ? "-" : sourceCommitTime.toString());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ChangeEvent)) {
            return false;
        }
        ChangeEvent that = (ChangeEvent) obj;
        return table.equals(that.table)
                && operation == that.operation
                && record.equals(that.record)
                && Objects.equals(previousRecord, that.previousRecord)
                && observedAt.equals(that.observedAt)
                && Objects.equals(sourceCommitTime, that.sourceCommitTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, operation, record, observedAt, sourceCommitTime);
    }

    @Override
    public String toString() {
        return "ChangeEvent{" +
                "table='" + table + '\'' +
                ", operation=" + operation +
                ", record=" + record +
                ", previousRecord=" + previousRecord +
                ", observedAt=" + observedAt +
                ", sourceCommitTime=" + sourceCommitTime +
                '}';
    }

    /**
     * Builder for {@link ChangeEvent} instances.
     */
    public static final class Builder {
        private String table;
        private Operation operation;
        private Map<String, Object> record;
        private Map<String, Object> previousRecord;
        private Instant observedAt;
        private Instant sourceCommitTime;

        private Builder() {
        }

        public Builder table(String table) {
            this.table = table;
            return this;
        }

        public Builder operation(Operation operation) {
            this.operation = operation;
            return this;
        }

        public Builder record(Map<String, Object> record) {
            this.record = record;
            return this;
        }

        public Builder previousRecord(Map<String, Object> previousRecord) {
            this.previousRecord = previousRecord;
            return this;
        }

        public Builder observedAt(Instant observedAt) {
            this.observedAt = observedAt;
            return this;
        }

        public Builder sourceCommitTime(Instant sourceCommitTime) {
            this.sourceCommitTime = sourceCommitTime;
            return this;
        }

        /**
         * @return the new event; never null
         * @throws NullPointerException if the table, operation or observation time are missing
         * @throws IllegalArgumentException if no record image is available for the operation
         */
        public ChangeEvent build() {
            return new ChangeEvent(this);
        }
    }
}
