/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.engine;

import java.util.Collections;
import java.util.Set;

import io.syncbase.SyncbaseException;

/**
 * Signals that a {@link SyncEngine} could not be started. The engine is left in the {@link SyncEngine.State#ERRORED}
 * state and must be stopped before it can be started again.
 */
public class StartupException extends SyncbaseException {

    private static final long serialVersionUID = 1L;

    private final Set<String> failedTables;

    public StartupException(String message, Throwable cause) {
        this(message, Collections.emptySet(), cause);
    }

    public StartupException(String message, Set<String> failedTables, Throwable cause) {
        super(message, cause);
        this.failedTables = Collections.unmodifiableSet(failedTables);
    }

    /**
     * @return the tables whose subscription failed; empty when the failure was not specific to a table
     */
    public Set<String> getFailedTables() {
        return failedTables;
    }
}
