/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.engine;

import java.io.Closeable;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import io.syncbase.data.ChangeEvent;

/**
 * An engine that subscribes to row-level changes of a set of tables, groups them into batches and hands those batches
 * to a {@link BatchSink}, with at-least-once semantics.
 * <p>
 * Buffered events live only in memory. Events that were received but not yet delivered when the process dies are lost;
 * the catch-up operations exist to recover them from the source after a restart.
 *
 * @author Syncbase Authors
 */
public interface SyncEngine extends Closeable {

    /**
     * The lifecycle states of an engine.
     * <p>
     * The normal progression is {@code STOPPED -> STARTING -> RUNNING -> STOPPING -> STOPPED}. A failed start moves the
     * engine to {@code ERRORED}, from which only {@link SyncEngine#stop()} leads back to {@code STOPPED}.
     */
    enum State {
        STOPPED,
        STARTING,
        RUNNING,
        STOPPING,
        ERRORED;
    }

    /**
     * Connect to the source, subscribe to every watched table and start the periodic flush. Calling this method on a
     * running engine has no effect.
     *
     * @throws StartupException if the connection or any subscription could not be established
     * @throws IllegalStateException if the engine is errored or in the middle of another transition
     */
    void start();

    /**
     * Unsubscribe from every table, deliver every buffered event and release all connections. Calling this method on a
     * stopped engine has no effect.
     *
     * @throws ShutdownException if the engine stopped but its connections could not be released cleanly
     */
    void stop();

    /**
     * Equivalent to {@link #stop()}.
     */
    @Override
    default void close() {
        stop();
    }

    /**
     * @return a snapshot of the engine's current status; never null
     */
    Status status();

    /**
     * Read the rows of a table that changed after a watermark, classified as inserts or updates.
     *
     * @param table the table name; may not be null
     * @param watermark the exclusive lower bound on modification time; may not be null
     * @param limit the maximum number of events to return; must be positive
     * @return a lazy, finite and restartable sequence of events in ascending modification order; never null
     */
    Iterable<ChangeEvent> readSince(String table, Instant watermark, int limit);

    /**
     * Read the recent changes of a table for a cold start.
     *
     * @param table the table name; may not be null
     * @param lastSyncTime the time of the last successful synchronization, or null to use the configured look-back window
     * @return a lazy, finite and restartable sequence of events; never null
     */
    Iterable<ChangeEvent> performInitialSync(String table, Instant lastSyncTime);

    /**
     * Read the changes of a table since its last delivered watermark (or the look-back window, if nothing was delivered
     * yet) and queue them for delivery through the same path as live events.
     *
     * @param table a watched table; may not be null
     * @return the number of events queued
     * @throws IllegalStateException if the engine is not running
     */
    int catchUp(String table);

    /**
     * An immutable snapshot of an engine's status.
     */
    final class Status {
        private final State state;
        private final int bufferedEventCount;
        private final Set<String> subscribedTables;
        private final Set<String> erroredTables;

        public Status(State state, int bufferedEventCount, Set<String> subscribedTables, Set<String> erroredTables) {
            this.state = Objects.requireNonNull(state);
            this.bufferedEventCount = bufferedEventCount;
            this.subscribedTables = Collections.unmodifiableSet(new TreeSet<>(subscribedTables));
            this.erroredTables = Collections.unmodifiableSet(new TreeSet<>(erroredTables));
        }

        public State state() {
            return state;
        }

        public boolean running() {
            return state == State.RUNNING;
        }

        /**
         * @return the number of events not yet delivered, including a batch currently held by the sink
         */
        public int bufferedEventCount() {
            return bufferedEventCount;
        }

        /**
         * @return the tables with a live subscription, in name order
         */
        public Set<String> subscribedTables() {
            return subscribedTables;
        }

        /**
         * @return the tables whose subscription reported an error after it was established
         */
        public Set<String> erroredTables() {
            return erroredTables;
        }

        @Override
        public String toString() {
            return "Status{state=" + state + ", running=" + running() + ", bufferedEventCount=" + bufferedEventCount
                    + ", subscribedTables=" + subscribedTables + ", erroredTables=" + erroredTables + "}";
        }
    }
}
