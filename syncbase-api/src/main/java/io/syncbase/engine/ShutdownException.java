/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.engine;

import io.syncbase.SyncbaseException;

/**
 * Signals that a {@link SyncEngine} stopped, but could not release its connections cleanly.
 */
public class ShutdownException extends SyncbaseException {

    private static final long serialVersionUID = 1L;

    public ShutdownException(String message, Throwable cause) {
        super(message, cause);
    }
}
