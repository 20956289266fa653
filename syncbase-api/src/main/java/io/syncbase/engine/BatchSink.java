/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.engine;

import java.util.List;

import io.syncbase.data.ChangeEvent;

/**
 * The downstream consumer of batches of change events.
 * <p>
 * Returning normally signals that the whole batch was handled; throwing any exception signals that it was not, and the
 * same batch will be offered again later, ahead of newer events. Because a batch may therefore be handled more than
 * once, implementations must write idempotently, for instance keyed on {@link ChangeEvent#idempotencyKey(String)}.
 * <p>
 * The engine invokes a sink from a single delivery thread, so implementations need not be thread-safe with respect to
 * themselves.
 */
@FunctionalInterface
public interface BatchSink {

    /**
     * Handle a non-empty batch of change events in arrival order.
     *
     * @param batch the events; never null or empty, and not to be modified
     * @throws Exception if the batch could not be handled
     */
    void handleBatch(List<ChangeEvent> batch) throws Exception;
}
