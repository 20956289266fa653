/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import java.sql.SQLException;
import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.syncbase.jdbc.QueryConnectionPool;
import io.syncbase.transport.FakeRealtimeTransport;
import io.syncbase.util.Clock;

@ExtendWith(MockitoExtension.class)
class ConnectionManagerTest {

    @Mock
    private QueryConnectionPool pool;
    private FakeRealtimeTransport transport;

    @BeforeEach
    void setUp() {
        transport = new FakeRealtimeTransport();
    }

    @Test
    void shouldConnectBothSides() throws SQLException {
        ConnectionManager manager = new ConnectionManager(transport, pool, Clock.system());

        manager.connect();
        manager.connect();

        assertThat(manager.state()).isEqualTo(ConnectionManager.State.CONNECTED);
        assertThat(manager.isConnected()).isTrue();
        assertThat(transport.connects()).isEqualTo(1);
        verify(pool).validate();
    }

    @Test
    void shouldNameFailedSide() throws SQLException {
        doThrow(new SQLException("password authentication failed")).when(pool).validate();
        ConnectionManager manager = new ConnectionManager(transport, pool, Clock.system());

        assertThatThrownBy(manager::connect)
                .isInstanceOf(ConnectionException.class)
                .hasMessageContaining("query connection pool")
                .hasMessageContaining("password authentication failed");
        assertThat(manager.state()).isEqualTo(ConnectionManager.State.FAILED);

        transport.failConnects(1);
        assertThatThrownBy(manager::connect).hasMessageContaining("realtime control connection");
    }

    @Test
    void shouldRetryUntilReady() {
        transport.failConnects(2);
        ConnectionManager manager = new ConnectionManager(transport, pool, Clock.system());

        manager.awaitReady(Duration.ofSeconds(5), Duration.ofMillis(10));

        assertThat(transport.connects()).isEqualTo(3);
        assertThat(manager.isConnected()).isTrue();
    }

    @Test
    void shouldGiveUpAfterTimeout() {
        transport.failConnects(Integer.MAX_VALUE);
        ConnectionManager manager = new ConnectionManager(transport, pool, Clock.system());

        assertThatThrownBy(() -> manager.awaitReady(Duration.ofMillis(100), Duration.ofMillis(20)))
                .isInstanceOf(ConnectionException.class)
                .hasMessageContaining("not ready")
                .hasCauseInstanceOf(ConnectionException.class);
    }

    @Test
    void shouldReleaseBothSidesEvenWhenOneFails() {
        transport.failOnClose();
        ConnectionManager manager = new ConnectionManager(transport, pool, Clock.system());
        manager.connect();

        assertThatThrownBy(manager::disconnect)
                .isInstanceOf(ConnectionException.class)
                .hasMessageContaining("realtime control connection");
        verify(pool).close();
        assertThat(manager.state()).isEqualTo(ConnectionManager.State.DISCONNECTED);
    }
}
