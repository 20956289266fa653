/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.transport;

/**
 * Receives the changes published on a {@link ChangeChannel}. Callbacks are made on a thread owned by the transport.
 */
public interface ChangeListener {

    /**
     * @param change a change published on the channel; never null
     */
    void onChange(RealtimeChange change);

    /**
     * Called when the channel can no longer deliver changes.
     *
     * @param error the cause; never null
     */
    void onError(Throwable error);
}
