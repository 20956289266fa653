/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.transport;

import io.syncbase.connection.ConnectionException;

/**
 * The control connection over which a data source publishes row-level changes.
 */
public interface RealtimeTransport extends AutoCloseable {

    /**
     * Establish the control connection. Connecting an already connected transport has no effect.
     *
     * @throws ConnectionException if the connection could not be established
     */
    void connect();

    boolean isConnected();

    /**
     * Open a channel delivering the changes of a table to the listener.
     *
     * @param table the table; may not be null
     * @param listener the listener; may not be null
     * @return the open channel; never null
     * @throws io.syncbase.SyncbaseException if the channel could not be opened
     */
    ChangeChannel openChannel(String table, ChangeListener listener);

    /**
     * Close every channel and release the control connection.
     *
     * @throws ConnectionException if the connection could not be released cleanly
     */
    @Override
    void close();
}
