/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.sink;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.syncbase.data.ChangeEvent;
import io.syncbase.engine.BatchSink;

/**
 * A sink that only logs the batches it receives: a summary at INFO and every event at DEBUG.
 */
public class LoggingBatchSink implements BatchSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingBatchSink.class);

    private final String keyColumn;

    public LoggingBatchSink(String keyColumn) {
        this.keyColumn = keyColumn;
    }

    @Override
    public void handleBatch(List<ChangeEvent> batch) {
        LOGGER.info("Received batch of {} change events", batch.size());
        if (LOGGER.isDebugEnabled()) {
            for (ChangeEvent event : batch) {
                LOGGER.debug("{} {}", event.idempotencyKey(keyColumn), event.record());
            }
        }
    }
}
