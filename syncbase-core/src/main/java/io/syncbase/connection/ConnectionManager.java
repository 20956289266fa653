/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.connection;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.syncbase.annotation.GuardedBy;
import io.syncbase.annotation.ThreadSafe;
import io.syncbase.jdbc.QueryConnectionPool;
import io.syncbase.transport.RealtimeTransport;
import io.syncbase.util.Clock;
import io.syncbase.util.Metronome;
import io.syncbase.util.Threads;

/**
 * Owns the two connections to the data source: the realtime control connection, over which changes are published,
 * and the pool of query connections used for catch-up reads.
 *
 * @author Syncbase Authors
 */
@ThreadSafe
public class ConnectionManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionManager.class);

    public enum State {
        DISCONNECTED,
        CONNECTED,
        FAILED
    }

    private final RealtimeTransport transport;
    private final QueryConnectionPool pool;
    private final Clock clock;

    @GuardedBy("this")
    private State state = State.DISCONNECTED;

    public ConnectionManager(RealtimeTransport transport, QueryConnectionPool pool, Clock clock) {
        this.transport = Objects.requireNonNull(transport);
        this.pool = Objects.requireNonNull(pool);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Establish the control connection and verify the query side with a round trip. Calling this method when already
     * connected has no effect.
     *
     * @throws ConnectionException naming the side that could not be established
     */
    public synchronized void connect() {
        if (state == State.CONNECTED) {
            return;
        }
        try {
            transport.connect();
        }
        catch (RuntimeException e) {
            state = State.FAILED;
            throw new ConnectionException("Unable to establish the realtime control connection: " + e.getMessage(), e);
        }
        try {
            pool.validate();
        }
        catch (SQLException | RuntimeException e) {
            state = State.FAILED;
            throw new ConnectionException("Unable to run a query through the query connection pool: " + e.getMessage(), e);
        }
        state = State.CONNECTED;
        LOGGER.info("Connected to the data source");
    }

    /**
     * Repeatedly try to {@link #connect()} until it succeeds or the timeout elapses.
     *
     * @param timeout the maximum time to wait; may not be null
     * @param interval the time between attempts; may not be null
     * @throws ConnectionException with the last failure as cause if the data source did not become reachable in time
     */
    public void awaitReady(Duration timeout, Duration interval) {
        final Threads.Timer timer = Threads.timer(clock, timeout);
        final Metronome metronome = Metronome.sleeper(interval, clock);
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                connect();
                LOGGER.info("Data source ready after {} attempt(s)", attempts);
                return;
            }
            catch (ConnectionException e) {
                if (timer.expired()) {
                    throw new ConnectionException("Data source not ready after " + attempts + " attempt(s) within " + timeout, e);
                }
                LOGGER.info("Data source not ready yet, retrying in {} ms: {}", interval.toMillis(), e.getMessage());
            }
            try {
                metronome.pause();
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConnectionException("Interrupted while waiting for the data source", e);
            }
        }
    }

    /**
     * Release both connections. Safe to call in any state; a failure to release one connection does not prevent
     * releasing the other.
     *
     * @throws ConnectionException if either connection could not be released cleanly
     */
    public synchronized void disconnect() {
        ConnectionException failure = null;
        try {
            transport.close();
        }
        catch (RuntimeException e) {
            failure = new ConnectionException("Failed to close the realtime control connection", e);
        }
        try {
            pool.close();
        }
        catch (RuntimeException e) {
            final ConnectionException poolFailure = new ConnectionException("Failed to close the query connection pool", e);
            if (failure == null) {
                failure = poolFailure;
            }
            else {
                failure.addSuppressed(poolFailure);
            }
        }
        state = State.DISCONNECTED;
        if (failure != null) {
            throw failure;
        }
        LOGGER.info("Disconnected from the data source");
    }

    public synchronized State state() {
        return state;
    }

    public synchronized boolean isConnected() {
        return state == State.CONNECTED && transport.isConnected();
    }
}
