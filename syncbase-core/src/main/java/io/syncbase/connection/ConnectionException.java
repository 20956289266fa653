/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.connection;

import io.syncbase.SyncbaseException;

/**
 * Signals that the control connection or the query connection to the data source is unusable.
 */
public class ConnectionException extends SyncbaseException {

    private static final long serialVersionUID = 1L;

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
