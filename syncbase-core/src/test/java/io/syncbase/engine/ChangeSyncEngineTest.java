/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.syncbase.SyncbaseException;
import io.syncbase.catchup.HistoricalStore;
import io.syncbase.catchup.InMemoryHistoricalStore;
import io.syncbase.config.Configuration;
import io.syncbase.data.ChangeEvent;
import io.syncbase.data.Operation;
import io.syncbase.engine.SyncEngine.State;
import io.syncbase.jdbc.QueryConnectionPool;
import io.syncbase.transport.FakeRealtimeTransport;
import io.syncbase.transport.RealtimeChange;
import io.syncbase.util.Clock;

class ChangeSyncEngineTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");

    private FakeRealtimeTransport transport;
    private QueryConnectionPool pool;
    private InMemoryHistoricalStore store;
    private List<List<ChangeEvent>> batches;
    private AtomicBoolean sinkFailing;
    private ChangeSyncEngine engine;

    @BeforeEach
    void setUp() {
        transport = new FakeRealtimeTransport();
        pool = mock(QueryConnectionPool.class);
        store = new InMemoryHistoricalStore();
        batches = new CopyOnWriteArrayList<>();
        sinkFailing = new AtomicBoolean();
    }

    @AfterEach
    void tearDown() {
        if (engine != null && engine.status().state() != State.STARTING) {
            try {
                engine.stop();
            }
            catch (SyncbaseException e) {
                // already reported by the test
            }
        }
    }

    private Configuration.Builder config() {
        return Configuration.create()
                .with(SyncEngineConfig.ENGINE_NAME, "test")
                .with(SyncEngineConfig.TABLE_INCLUDE_LIST, "orders,users")
                .with(SyncEngineConfig.MAX_BATCH_SIZE, 3)
                .with(SyncEngineConfig.MAX_BATCH_AGE_MS, Duration.ofHours(1).toMillis())
                .with(SyncEngineConfig.SHUTDOWN_TIMEOUT_MS, 5000);
    }

    private ChangeSyncEngine engine(Configuration config) {
        engine = ChangeSyncEngine.create()
                .using(config)
                .using(transport)
                .using(pool)
                .using(store)
                .using(Clock.fixed(NOW))
                .notifying(batch -> {
                    if (sinkFailing.get()) {
                        throw new IllegalStateException("sink unavailable");
                    }
                    batches.add(new ArrayList<>(batch));
                })
                .build();
        return engine;
    }

    private List<ChangeEvent> delivered() {
        return batches.stream().flatMap(List::stream).collect(Collectors.toList());
    }

    private static RealtimeChange insert(int id, String commitTimestamp) {
        return new RealtimeChange("INSERT", "public", "orders", Map.of("id", id), null, commitTimestamp);
    }

    @Test
    void shouldStartAndDeliver() {
        engine(config().build()).start();

        assertThat(engine.status().state()).isEqualTo(State.RUNNING);
        assertThat(engine.status().running()).isTrue();
        assertThat(engine.status().subscribedTables()).containsExactly("orders", "users");

        transport.publish("orders", insert(1, null));
        transport.publish("orders", insert(2, null));
        transport.publish("orders", insert(3, null));

        await().atMost(5, TimeUnit.SECONDS).until(() -> batches.size() == 1);
        assertThat(batches.get(0)).extracting(e -> e.record().get("id")).containsExactly(1, 2, 3);
    }

    @Test
    void shouldIgnoreSecondStart() {
        engine(config().build()).start();

        engine.start();

        assertThat(transport.connects()).isEqualTo(1);
        assertThat(engine.status().state()).isEqualTo(State.RUNNING);
    }

    @Test
    void shouldDrainOnStop() {
        engine(config().build()).start();
        transport.publish("orders", insert(1, null));
        transport.publish("orders", insert(2, null));
        assertThat(engine.status().bufferedEventCount()).isEqualTo(2);

        engine.stop();

        assertThat(batches).hasSize(1);
        assertThat(batches.get(0)).hasSize(2);
        assertThat(engine.status().state()).isEqualTo(State.STOPPED);
        assertThat(engine.status().bufferedEventCount()).isZero();
        assertThat(engine.status().subscribedTables()).isEmpty();
        assertThat(transport.isConnected()).isFalse();
        verify(pool).close();

        engine.stop();
    }

    @Test
    void shouldKeepEventsBufferedWhenSinkFailsDuringStop() {
        engine(config().build()).start();
        transport.publish("orders", insert(1, null));
        sinkFailing.set(true);

        engine.stop();

        assertThat(engine.status().state()).isEqualTo(State.STOPPED);
        assertThat(engine.status().bufferedEventCount()).isEqualTo(1);
        assertThat(batches).isEmpty();
    }

    @Test
    void shouldBoundStopByShutdownTimeoutWhenSinkHangs() throws InterruptedException {
        CountDownLatch inSink = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        engine = ChangeSyncEngine.create()
                .using(config().with(SyncEngineConfig.SHUTDOWN_TIMEOUT_MS, 200).build())
                .using(transport)
                .using(pool)
                .using(store)
                .using(Clock.fixed(NOW))
                .notifying(batch -> {
                    if (calls.getAndIncrement() == 0) {
                        inSink.countDown();
                        awaitIgnoringInterrupts(release);
                        return;
                    }
                    batches.add(new ArrayList<>(batch));
                })
                .build();
        try {
            engine.start();
            transport.publish("orders", insert(1, null));
            transport.publish("orders", insert(2, null));
            transport.publish("orders", insert(3, null));
            assertThat(inSink.await(5, TimeUnit.SECONDS)).isTrue();

            long started = System.nanoTime();
            engine.stop();
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofMillis(1000));
            assertThat(engine.status().state()).isEqualTo(State.STOPPED);
            assertThat(engine.status().bufferedEventCount()).isEqualTo(3);

            engine.start();
            transport.publish("orders", insert(4, null));
            transport.publish("orders", insert(5, null));
            transport.publish("orders", insert(6, null));

            await().atMost(5, TimeUnit.SECONDS).until(() -> batches.size() == 1);
            assertThat(batches.get(0)).extracting(e -> e.record().get("id")).containsExactly(4, 5, 6);
        }
        finally {
            release.countDown();
        }
    }

    private static void awaitIgnoringInterrupts(CountDownLatch latch) {
        boolean interrupted = false;
        while (true) {
            try {
                latch.await();
                break;
            }
            catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    void shouldRestartAfterStop() {
        engine(config().build()).start();
        engine.stop();

        engine.start();

        assertThat(engine.status().state()).isEqualTo(State.RUNNING);
        assertThat(engine.status().subscribedTables()).containsExactly("orders", "users");
    }

    @Test
    void shouldFailStartOnSubscriptionError() {
        transport.failOpening("users");
        engine(config().build());

        assertThatThrownBy(engine::start)
                .isInstanceOf(StartupException.class)
                .satisfies(e -> assertThat(((StartupException) e).getFailedTables()).containsExactly("users"));
        assertThat(engine.status().state()).isEqualTo(State.ERRORED);
        assertThatThrownBy(engine::start).isInstanceOf(IllegalStateException.class);

        engine.stop();

        assertThat(engine.status().state()).isEqualTo(State.STOPPED);
        assertThat(transport.openTables()).isEmpty();
    }

    @Test
    void shouldFailStartOnConnectionError() throws SQLException {
        doThrow(new SQLException("connection refused")).when(pool).validate();
        engine(config().build());

        assertThatThrownBy(engine::start)
                .isInstanceOf(StartupException.class)
                .hasMessageContaining("could not connect");
        assertThat(engine.status().state()).isEqualTo(State.ERRORED);
        assertThat(transport.openTables()).isEmpty();
    }

    @Test
    void shouldWaitForDataSourceWhenConfigured() {
        transport.failConnects(2);
        engine = ChangeSyncEngine.create()
                .using(config()
                        .with(SyncEngineConfig.CONNECTION_WAIT_TIMEOUT_MS, 5000)
                        .with(SyncEngineConfig.CONNECTION_WAIT_INTERVAL_MS, 10)
                        .build())
                .using(transport)
                .using(pool)
                .using(store)
                .notifying(batch -> {
                })
                .build();

        engine.start();

        assertThat(transport.connects()).isEqualTo(3);
        assertThat(engine.status().running()).isTrue();
    }

    @Test
    void shouldReportShutdownFailure() {
        transport.failOnClose();
        engine(config().build()).start();

        assertThatThrownBy(engine::stop).isInstanceOf(ShutdownException.class);

        assertThat(engine.status().state()).isEqualTo(State.STOPPED);
    }

    @Test
    void shouldReportErroredSubscriptions() {
        engine(config().build()).start();

        transport.fail("users", new IllegalStateException("connection lost"));

        assertThat(engine.status().subscribedTables()).containsExactly("orders");
        assertThat(engine.status().erroredTables()).containsExactly("users");
        assertThat(engine.status().running()).isTrue();
    }

    @Test
    void shouldCatchUpThroughTheSamePath() {
        store.add("orders", Map.of("id", 10), NOW.minus(Duration.ofDays(2)), NOW.minus(Duration.ofHours(2)))
                .add("orders", Map.of("id", 11), NOW.minus(Duration.ofHours(1)), NOW.minus(Duration.ofHours(1)));
        engine(config().build()).start();
        transport.publish("orders", insert(1, null));

        int queued = engine.catchUp("orders");
        engine.stop();

        assertThat(queued).isEqualTo(2);
        assertThat(delivered()).extracting(e -> e.record().get("id")).containsExactly(1, 10, 11);
        assertThat(delivered()).extracting(ChangeEvent::operation)
                .containsExactly(Operation.INSERT, Operation.UPDATE, Operation.INSERT);
        assertThat(engine.watermarks()).containsEntry("orders", NOW.minus(Duration.ofHours(1)));
    }

    @Test
    void shouldCatchUpFromDeliveredWatermark() {
        store.add("orders", Map.of("id", 10), NOW.minus(Duration.ofHours(3)), NOW.minus(Duration.ofHours(3)))
                .add("orders", Map.of("id", 11), NOW.minus(Duration.ofMinutes(30)), NOW.minus(Duration.ofMinutes(30)));
        engine(config().build()).start();
        transport.publish("orders", insert(1, NOW.minus(Duration.ofHours(1)).toString()));
        transport.publish("orders", insert(2, NOW.minus(Duration.ofHours(1)).toString()));
        transport.publish("orders", insert(3, NOW.minus(Duration.ofHours(1)).toString()));
        await().atMost(5, TimeUnit.SECONDS).until(() -> engine.watermarks().containsKey("orders"));

        int queued = engine.catchUp("orders");

        assertThat(queued).isEqualTo(1);
    }

    @Test
    void shouldCatchUpOnStartWhenConfigured() {
        store.add("users", Map.of("id", 5), NOW.minus(Duration.ofHours(1)), NOW.minus(Duration.ofHours(1)));
        engine(config().with(SyncEngineConfig.CATCHUP_ON_START, true).build()).start();

        assertThat(engine.status().bufferedEventCount()).isEqualTo(1);
        assertThat(store.fetches()).isEqualTo(2);
    }

    @Test
    void shouldCatchUpTableWhenChangeWasTruncated() {
        store.add("orders", Map.of("id", 8, "notes", "long text"), NOW.minus(Duration.ofDays(3)), NOW.minus(Duration.ofMinutes(5)));
        engine(config().build()).start();

        transport.publish("orders", new RealtimeChange("UPDATE", "public", "orders", Map.of("id", 8), Map.of("id", 8),
                NOW.minus(Duration.ofMinutes(5)).toString(), true));

        await().atMost(5, TimeUnit.SECONDS).until(() -> engine.status().bufferedEventCount() == 1);
        engine.stop();
        assertThat(delivered()).hasSize(1);
        assertThat(delivered().get(0).operation()).isEqualTo(Operation.UPDATE);
        assertThat(delivered().get(0).record()).containsEntry("notes", "long text");
        assertThat(store.fetches()).isEqualTo(1);
    }

    @Test
    void shouldKeepRunningWhenCatchUpOnStartFails() {
        HistoricalStore failingStore = mock(HistoricalStore.class);
        when(failingStore.fetchChangedSince(anyString(), any(), anyInt())).thenThrow(new IllegalStateException("unsupported column type"));
        engine = ChangeSyncEngine.create()
                .using(config().with(SyncEngineConfig.CATCHUP_ON_START, true).build())
                .using(transport)
                .using(pool)
                .using(failingStore)
                .using(Clock.fixed(NOW))
                .notifying(batch -> batches.add(new ArrayList<>(batch)))
                .build();

        engine.start();

        assertThat(engine.status().running()).isTrue();
        assertThat(engine.status().subscribedTables()).containsExactly("orders", "users");
    }

    @Test
    void shouldRejectCatchUpWhenNotRunningOrUnwatched() {
        engine(config().build());

        assertThatThrownBy(() -> engine.catchUp("orders")).isInstanceOf(IllegalStateException.class);

        engine.start();
        assertThatThrownBy(() -> engine.catchUp("payments")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldReadSinceWithoutRunning() {
        store.add("orders", Map.of("id", 10), NOW.minus(Duration.ofHours(1)), NOW.minus(Duration.ofHours(1)));
        engine(config().build());

        List<ChangeEvent> events = new ArrayList<>();
        engine.readSince("orders", NOW.minus(Duration.ofHours(2)), 10).forEach(events::add);
        engine.performInitialSync("orders", null).forEach(events::add);

        assertThat(events).hasSize(2).allSatisfy(e -> assertThat(e.operation()).isEqualTo(Operation.INSERT));
    }

    @Test
    void shouldRequireTablesAndCollaborators() {
        assertThatThrownBy(() -> engine(Configuration.create().with(SyncEngineConfig.TABLE_INCLUDE_LIST, " , ").build()))
                .isInstanceOf(SyncbaseException.class);
        assertThatThrownBy(() -> ChangeSyncEngine.create().using(config().build()).using(transport).using(pool).build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("sink");
    }
}
