/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.subscription;

import io.syncbase.SyncbaseException;

/**
 * Signals that the subscription to a table could not be established.
 */
public class SubscriptionException extends SyncbaseException {

    private static final long serialVersionUID = 1L;

    private final String table;

    public SubscriptionException(String table, String message) {
        super(message);
        this.table = table;
    }

    public SubscriptionException(String table, String message, Throwable cause) {
        super(message, cause);
        this.table = table;
    }

    public String getTable() {
        return table;
    }
}
