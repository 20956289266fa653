/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.connector.postgresql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;

import io.syncbase.config.Configuration;
import io.syncbase.connection.ConnectionException;
import io.syncbase.jdbc.JdbcConnection;
import io.syncbase.jdbc.JdbcConnectionException;
import io.syncbase.transport.ChangeChannel;
import io.syncbase.transport.ChangeListener;
import io.syncbase.transport.RealtimeChange;
import io.syncbase.util.Clock;

class PostgresNotificationTransportTest {

    private static final String PAYLOAD = "{\"type\":\"INSERT\",\"table\":\"orders\",\"record\":{\"id\":1}}";

    private JdbcConnection connection;
    private PGConnection pgConnection;
    private PostgresNotificationTransport transport;
    private final List<RealtimeChange> changes = new CopyOnWriteArrayList<>();
    private final List<Throwable> errors = new CopyOnWriteArrayList<>();
    private final ChangeListener listener = new ChangeListener() {
        @Override
        public void onChange(RealtimeChange change) {
            changes.add(change);
        }

        @Override
        public void onError(Throwable error) {
            errors.add(error);
        }
    };

    @BeforeEach
    void setUp() throws SQLException {
        connection = mock(JdbcConnection.class);
        pgConnection = mock(PGConnection.class);
        Connection jdbc = mock(Connection.class);
        lenient().when(connection.isConnected()).thenReturn(true);
        lenient().when(connection.connection()).thenReturn(jdbc);
        lenient().when(jdbc.unwrap(PGConnection.class)).thenReturn(pgConnection);
        lenient().when(pgConnection.getNotifications()).thenReturn(new PGNotification[0]);
        transport = transport(PostgresConnectorConfigTest.minimal()
                .with(PostgresConnectorConfig.REPLICATION_SETUP_ENABLED, false)
                .with(PostgresConnectorConfig.POLL_INTERVAL_MS, 10));
    }

    @AfterEach
    void tearDown() {
        transport.close();
    }

    private PostgresNotificationTransport transport(Configuration.Builder config) {
        return new PostgresNotificationTransport(new PostgresConnectorConfig(config.build()), connection, Clock.system());
    }

    private static PGNotification notification(String channel, String payload) {
        PGNotification notification = mock(PGNotification.class);
        when(notification.getName()).thenReturn(channel);
        when(notification.getParameter()).thenReturn(payload);
        return notification;
    }

    @Test
    void shouldListenOnTableChannel() throws SQLException {
        ChangeChannel channel = transport.openChannel("orders", listener);

        assertThat(channel.name()).isEqualTo("syncbase_orders");
        verify(connection).execute("LISTEN \"syncbase_orders\"");
        assertThatThrownBy(() -> transport.openChannel("orders", listener)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldForgetListenerWhenListenFails() throws SQLException {
        doThrow(new SQLException("permission denied")).when(connection).execute(anyString());

        assertThatThrownBy(() -> transport.openChannel("orders", listener)).isInstanceOf(JdbcConnectionException.class);

        transport.dispatch("syncbase_orders", PAYLOAD);
        assertThat(changes).isEmpty();
    }

    @Test
    void shouldDispatchToChannelListener() {
        transport.openChannel("orders", listener);

        transport.dispatch("syncbase_orders", PAYLOAD);
        transport.dispatch("syncbase_users", PAYLOAD);
        transport.dispatch("syncbase_orders", "not json");

        assertThat(changes).hasSize(1);
        assertThat(changes.get(0).newRecord()).containsEntry("id", 1);
    }

    @Test
    void shouldPollNotificationsAfterConnect() throws SQLException {
        when(pgConnection.getNotifications())
                .thenReturn(new PGNotification[]{ notification("syncbase_orders", PAYLOAD) })
                .thenReturn(new PGNotification[0]);
        transport.openChannel("orders", listener);

        transport.connect();

        await().atMost(5, TimeUnit.SECONDS).until(() -> changes.size() == 1);
        assertThat(transport.isConnected()).isTrue();
        verify(connection).connect();
        verify(connection, never()).prepareQueryAndMap(anyString(), any(), any());
    }

    @Test
    void shouldReportLostConnectionToListeners() throws SQLException {
        when(connection.queryAndMap(eq("SELECT 1"), any())).thenThrow(new SQLException("terminating connection"));
        transport.openChannel("orders", listener);

        transport.connect();

        await().atMost(5, TimeUnit.SECONDS).until(() -> errors.size() == 1);
        assertThat(errors.get(0)).hasMessage("terminating connection");
        assertThat(transport.isConnected()).isFalse();
    }

    @Test
    void shouldUnlistenWhenChannelCloses() throws SQLException {
        transport.connect();
        ChangeChannel channel = transport.openChannel("orders", listener);

        channel.close();
        channel.close();

        verify(connection).execute("UNLISTEN \"syncbase_orders\"");
        transport.dispatch("syncbase_orders", PAYLOAD);
        assertThat(changes).isEmpty();
    }

    @Test
    void shouldWrapConnectFailure() throws SQLException {
        when(connection.connect()).thenThrow(new SQLException("connection refused"));

        assertThatThrownBy(transport::connect)
                .isInstanceOf(ConnectionException.class)
                .hasMessageContaining("connection refused");
        assertThat(transport.isConnected()).isFalse();
    }

    @Test
    void shouldRemoveTriggersOnCloseWhenConfigured() throws SQLException {
        PostgresNotificationTransport tearingDown = transport(PostgresConnectorConfigTest.minimal()
                .with(PostgresConnectorConfig.REPLICATION_SETUP_ENABLED, false)
                .with(PostgresConnectorConfig.REPLICATION_TEARDOWN_ENABLED, true));

        tearingDown.close();

        verify(connection).execute("DROP TRIGGER IF EXISTS syncbase_notify ON \"public\".\"orders\"");
        verify(connection).execute("DROP TRIGGER IF EXISTS syncbase_notify ON \"public\".\"users\"");
        verify(connection).close();
    }
}
