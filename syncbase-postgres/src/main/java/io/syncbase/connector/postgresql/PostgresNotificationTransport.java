/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.connector.postgresql;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.syncbase.annotation.GuardedBy;
import io.syncbase.annotation.ThreadSafe;
import io.syncbase.annotation.VisibleForTesting;
import io.syncbase.connection.ConnectionException;
import io.syncbase.jdbc.JdbcConnection;
import io.syncbase.jdbc.JdbcConnectionException;
import io.syncbase.transport.ChangeChannel;
import io.syncbase.transport.ChangeListener;
import io.syncbase.transport.RealtimeChange;
import io.syncbase.transport.RealtimeTransport;
import io.syncbase.util.Clock;
import io.syncbase.util.Metronome;
import io.syncbase.util.Threads;

/**
 * A {@link RealtimeTransport} over PostgreSQL {@code LISTEN/NOTIFY}. Each table is a channel; a single thread polls
 * the control connection for pending notifications and dispatches them to the listener of their channel.
 *
 * @author Syncbase Authors
 */
@ThreadSafe
public class PostgresNotificationTransport implements RealtimeTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresNotificationTransport.class);

    private static final long POLLER_STOP_TIMEOUT_SECONDS = 5;

    private final PostgresConnectorConfig config;
    private final JdbcConnection connection;
    private final PostgresReplicationSetup replicationSetup;
    private final Set<String> tables;
    private final Clock clock;
    private final Map<String, ChangeListener> listenersByChannel = new ConcurrentHashMap<>();

    @GuardedBy("this")
    private ExecutorService poller;
    private volatile boolean running;

    public PostgresNotificationTransport(PostgresConnectorConfig config) {
        this(config, config.createControlConnection(), Clock.system());
    }

    @VisibleForTesting
    PostgresNotificationTransport(PostgresConnectorConfig config, JdbcConnection connection, Clock clock) {
        this.config = config;
        this.connection = connection;
        this.replicationSetup = new PostgresReplicationSetup(connection, config);
        this.tables = new LinkedHashSet<>(config.getTables());
        this.clock = clock;
    }

    @Override
    public synchronized void connect() {
        if (running) {
            return;
        }
        try {
            connection.connect();
            if (config.isReplicationSetupEnabled()) {
                replicationSetup.install(tables);
            }
        }
        catch (SQLException e) {
            throw new ConnectionException("Unable to connect to PostgreSQL: " + e.getMessage(), e);
        }
        running = true;
        poller = Executors.newSingleThreadExecutor(Threads.threadFactory(config.getEngineName(), "notification-poll", false, true));
        poller.execute(this::poll);
    }

    @Override
    public boolean isConnected() {
        try {
            return running && connection.isConnected();
        }
        catch (SQLException e) {
            return false;
        }
    }

    @Override
    public ChangeChannel openChannel(String table, ChangeListener listener) {
        final String channel = config.channelName(table);
        final String quotedChannel = JdbcConnection.quoted(channel);
        if (listenersByChannel.putIfAbsent(channel, listener) != null) {
            throw new IllegalStateException("Channel '" + channel + "' is already open");
        }
        try {
            connection.execute("LISTEN " + quotedChannel);
        }
        catch (SQLException e) {
            listenersByChannel.remove(channel, listener);
            throw new JdbcConnectionException("Unable to listen on channel '" + channel + "'", e);
        }
        LOGGER.debug("Listening on channel '{}'", channel);
        return new NotificationChannel(channel, quotedChannel);
    }

    private void poll() {
        final Metronome metronome = Metronome.sleeper(config.getPollInterval(), clock);
        while (running) {
            try {
                metronome.pause();
                pollOnce();
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            catch (SQLException | RuntimeException e) {
                if (running) {
                    LOGGER.error("Lost the PostgreSQL notification connection", e);
                    running = false;
                    new ArrayList<>(listenersByChannel.values()).forEach(listener -> listener.onError(e));
                }
                return;
            }
        }
    }

    @VisibleForTesting
    void pollOnce() throws SQLException {
        // a round trip makes the driver read notifications that arrived since the last one
        connection.queryAndMap("SELECT 1", rs -> null);
        final PGNotification[] notifications = connection.connection().unwrap(PGConnection.class).getNotifications();
        if (notifications == null) {
            return;
        }
        for (PGNotification notification : notifications) {
            dispatch(notification.getName(), notification.getParameter());
        }
    }

    @VisibleForTesting
    void dispatch(String channel, String payload) {
        final ChangeListener listener = listenersByChannel.get(channel);
        if (listener == null) {
            LOGGER.debug("Ignoring notification on channel '{}' without listener", channel);
            return;
        }
        final RealtimeChange change;
        try {
            change = NotificationPayloads.parse(payload);
        }
        catch (IllegalArgumentException e) {
            LOGGER.warn("Dropping malformed notification on channel '{}': {}", channel, e.getMessage());
            return;
        }
        listener.onChange(change);
    }

    @Override
    public synchronized void close() {
        running = false;
        if (poller != null) {
            poller.shutdown();
            try {
                if (!poller.awaitTermination(POLLER_STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    poller.shutdownNow();
                }
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                poller.shutdownNow();
            }
            poller = null;
        }
        listenersByChannel.clear();
        if (config.isReplicationTeardownEnabled()) {
            try {
                replicationSetup.uninstall(tables);
            }
            catch (SQLException e) {
                LOGGER.warn("Failed to remove the notification triggers", e);
            }
        }
        try {
            connection.close();
        }
        catch (SQLException e) {
            throw new ConnectionException("Failed to close the PostgreSQL control connection", e);
        }
    }

    private class NotificationChannel implements ChangeChannel {
        private final String name;
        private final String quotedName;
        private volatile boolean closed;

        NotificationChannel(String name, String quotedName) {
            this.name = name;
            this.quotedName = quotedName;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            listenersByChannel.remove(name);
            if (!isConnected()) {
                return;
            }
            try {
                connection.execute("UNLISTEN " + quotedName);
                LOGGER.debug("Stopped listening on channel '{}'", name);
            }
            catch (SQLException e) {
                throw new JdbcConnectionException("Unable to stop listening on channel '" + name + "'", e);
            }
        }
    }
}
