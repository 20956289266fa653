/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase;

/**
 * Base unchecked exception for all failures raised by Syncbase components.
 */
public class SyncbaseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SyncbaseException() {
        super();
    }

    public SyncbaseException(String message) {
        super(message);
    }

    public SyncbaseException(Throwable cause) {
        super(cause);
    }

    public SyncbaseException(String message, Throwable cause) {
        super(message, cause);
    }

    protected SyncbaseException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
