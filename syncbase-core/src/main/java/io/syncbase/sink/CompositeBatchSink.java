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
 * Delivers every batch to several sinks in order. The batch fails as soon as one sink fails, and the whole batch is
 * then offered again to every sink, so each delegate must be idempotent.
 */
public class CompositeBatchSink implements BatchSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(CompositeBatchSink.class);

    private final List<BatchSink> delegates;

    public CompositeBatchSink(List<BatchSink> delegates) {
        if (delegates.isEmpty()) {
            throw new IllegalArgumentException("At least one sink is required");
        }
        this.delegates = List.copyOf(delegates);
    }

    public CompositeBatchSink(BatchSink... delegates) {
        this(List.of(delegates));
    }

    @Override
    public void handleBatch(List<ChangeEvent> batch) throws Exception {
        for (int i = 0; i < delegates.size(); i++) {
            try {
                delegates.get(i).handleBatch(batch);
            }
            catch (Exception e) {
                LOGGER.debug("Sink {} of {} failed on a batch of {} events", i + 1, delegates.size(), batch.size());
                throw e;
            }
        }
    }
}
