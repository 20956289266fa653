/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.transport;

/**
 * An open subscription to the changes of a single table.
 */
public interface ChangeChannel extends AutoCloseable {

    /**
     * @return the name of the channel within the transport
     */
    String name();

    /**
     * Stop receiving changes. Closing an already closed channel has no effect.
     */
    @Override
    void close();
}
