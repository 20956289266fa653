/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.engine;

import io.syncbase.SyncbaseException;

/**
 * Signals that a {@link BatchSink} failed to handle a batch. The batch is retained and retried.
 */
public class DeliveryException extends SyncbaseException {

    private static final long serialVersionUID = 1L;

    private final int batchSize;

    public DeliveryException(String message, int batchSize, Throwable cause) {
        super(message, cause);
        this.batchSize = batchSize;
    }

    /**
     * @return the number of events in the batch that could not be delivered
     */
    public int getBatchSize() {
        return batchSize;
    }
}
