/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.pipeline;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import io.syncbase.annotation.ThreadSafe;
import io.syncbase.data.ChangeEvent;

/**
 * Tracks, per table, the latest source commit time of the events that were delivered successfully. A watermark never
 * moves backwards.
 */
@ThreadSafe
public class WatermarkTracker {

    private final Map<String, Instant> watermarks = new ConcurrentHashMap<>();

    /**
     * Advance the watermarks with a delivered batch. Events without a source commit time are ignored.
     *
     * @param batch the delivered events; may not be null
     */
    public void advance(List<ChangeEvent> batch) {
        final Map<String, Instant> latest = new HashMap<>();
        for (ChangeEvent event : batch) {
            event.sourceCommitTime().ifPresent(time -> latest.merge(event.table(), time, WatermarkTracker::max));
        }
        latest.forEach((table, time) -> watermarks.merge(table, time, WatermarkTracker::max));
    }

    private static Instant max(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }

    public Optional<Instant> watermark(String table) {
        return Optional.ofNullable(watermarks.get(table));
    }

    /**
     * @return a copy of all watermarks, ordered by table name
     */
    public Map<String, Instant> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(watermarks));
    }
}
