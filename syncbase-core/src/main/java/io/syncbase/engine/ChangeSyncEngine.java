/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.engine;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.syncbase.SyncbaseException;
import io.syncbase.catchup.CatchUpReader;
import io.syncbase.catchup.CatchUpSequence;
import io.syncbase.catchup.HistoricalStore;
import io.syncbase.config.Configuration;
import io.syncbase.connection.ConnectionException;
import io.syncbase.connection.ConnectionManager;
import io.syncbase.data.ChangeEvent;
import io.syncbase.jdbc.JdbcConfiguration;
import io.syncbase.jdbc.JdbcHistoricalStore;
import io.syncbase.jdbc.QueryConnectionPool;
import io.syncbase.pipeline.ChangeEventAccumulator;
import io.syncbase.pipeline.DeliveryPipeline;
import io.syncbase.pipeline.WatermarkTracker;
import io.syncbase.subscription.SubscriptionException;
import io.syncbase.subscription.SubscriptionRegistry;
import io.syncbase.transport.RealtimeTransport;
import io.syncbase.util.Clock;
import io.syncbase.util.Threads;

/**
 * The {@link SyncEngine} that ties the connections, subscriptions, batching, delivery and catch-up together and drives
 * their lifecycle.
 * <p>
 * Live changes flow from the {@link RealtimeTransport} through the {@link SubscriptionRegistry} into the
 * {@link ChangeEventAccumulator}, which hands batches to the {@link DeliveryPipeline} and thus to the {@link BatchSink}.
 * Events queued by {@link #catchUp(String)} take the same path. A live change too large for the transport to publish
 * in full makes the engine catch up its table in the background.
 * <p>
 * Buffered events are held in memory only; events not yet delivered when the process dies are lost and must be
 * recovered with a catch-up after restart.
 *
 * @author Syncbase Authors
 */
public final class ChangeSyncEngine implements SyncEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChangeSyncEngine.class);

    private final SyncEngineConfig config;
    private final Set<String> tables;
    private final ConnectionManager connectionManager;
    private final SubscriptionRegistry registry;
    private final ChangeEventAccumulator accumulator;
    private final WatermarkTracker watermarks;
    private final CatchUpReader catchUpReader;
    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);
    private final Set<String> requestedCatchUps = ConcurrentHashMap.newKeySet();
    private volatile ExecutorService catchUpExecutor;

    private ChangeSyncEngine(Builder builder) {
        this.config = new SyncEngineConfig(builder.config);
        this.tables = config.getTables();
        if (tables.isEmpty()) {
            throw new SyncbaseException("At least one table must be listed in '" + SyncEngineConfig.TABLE_INCLUDE_LIST.name() + "'");
        }
        final Clock clock = builder.clock;
        this.watermarks = new WatermarkTracker();
        final DeliveryPipeline pipeline = new DeliveryPipeline(builder.sink, watermarks, clock);
        this.accumulator = new ChangeEventAccumulator(config.getEngineName(), config.getMaxBatchSize(), config.getMaxBatchAge(),
                config.getShutdownTimeout(), pipeline);
        this.connectionManager = new ConnectionManager(builder.transport, builder.pool, clock);
        this.registry = new SubscriptionRegistry(builder.transport, tables, accumulator::push, this::requestCatchUp, clock);
        final HistoricalStore store = builder.store != null
                ? builder.store
                : new JdbcHistoricalStore(builder.pool, JdbcConfiguration.adapt(builder.config.subset("database.", true)).getSchema(),
                        config.getCreatedColumn(), config.getModifiedColumn());
        this.catchUpReader = new CatchUpReader(store, clock, config.getCatchUpLookback(), config.getCatchUpMaxRows());
    }

    public static Builder create() {
        return new Builder();
    }

    @Override
    public void start() {
        if (state.get() == State.RUNNING) {
            LOGGER.debug("Engine '{}' is already running", config.getEngineName());
            return;
        }
        if (!state.compareAndSet(State.STOPPED, State.STARTING)) {
            throw new IllegalStateException("Cannot start engine '" + config.getEngineName() + "' in state " + state.get()
                    + (state.get() == State.ERRORED ? "; stop it first" : ""));
        }
        LOGGER.info("Starting engine '{}' for tables {}", config.getEngineName(), tables);
        catchUpExecutor = Executors.newSingleThreadExecutor(Threads.threadFactory(config.getEngineName(), "catch-up", false, true));

        LOGGER.debug("Connecting to the data source");
        try {
            if (config.getConnectionWaitTimeout().isZero()) {
                connectionManager.connect();
            }
            else {
                connectionManager.awaitReady(config.getConnectionWaitTimeout(), config.getConnectionWaitInterval());
            }
        }
        catch (ConnectionException e) {
            state.set(State.ERRORED);
            throw new StartupException("Engine '" + config.getEngineName() + "' could not connect: " + e.getMessage(), e);
        }

        LOGGER.debug("Subscribing to {} tables", tables.size());
        final Map<String, SubscriptionException> failures = new LinkedHashMap<>();
        for (String table : tables) {
            try {
                registry.subscribe(table);
            }
            catch (SubscriptionException e) {
                failures.put(table, e);
            }
        }
        if (!failures.isEmpty()) {
            state.set(State.ERRORED);
            final StartupException error = new StartupException("Engine '" + config.getEngineName()
                    + "' could not subscribe to tables " + failures.keySet(), failures.keySet(), failures.values().iterator().next());
            failures.values().stream().skip(1).forEach(error::addSuppressed);
            throw error;
        }

        LOGGER.debug("Starting the batch flush");
        accumulator.start();
        state.set(State.RUNNING);
        LOGGER.info("Engine '{}' is running", config.getEngineName());

        if (config.isCatchUpOnStart()) {
            for (String table : tables) {
                try {
                    catchUp(table);
                }
                catch (RuntimeException e) {
                    LOGGER.warn("Catch-up of table '{}' failed; live changes are still captured", table, e);
                }
            }
        }
    }

    @Override
    public void stop() {
        final State current = state.get();
        if (current == State.STOPPED || current == State.STOPPING) {
            LOGGER.debug("Engine '{}' is already {}", config.getEngineName(), current);
            return;
        }
        if (current == State.STARTING) {
            throw new IllegalStateException("Cannot stop engine '" + config.getEngineName() + "' while it is starting");
        }
        if (!state.compareAndSet(current, State.STOPPING)) {
            stop();
            return;
        }
        LOGGER.info("Stopping engine '{}'", config.getEngineName());

        ConnectionException disconnectFailure = null;
        try {
            LOGGER.debug("Cancelling catch-up reads");
            final ExecutorService executor = catchUpExecutor;
            catchUpExecutor = null;
            if (executor != null) {
                executor.shutdownNow();
            }
            requestedCatchUps.clear();
            catchUpReader.cancel();
            LOGGER.debug("Unsubscribing from all tables");
            registry.unsubscribeAll();
            LOGGER.debug("Delivering buffered events");
            if (!accumulator.drain()) {
                LOGGER.warn("Engine '{}' stopped with {} undelivered events", config.getEngineName(), accumulator.bufferedEventCount());
            }
        }
        finally {
            try {
                LOGGER.debug("Disconnecting from the data source");
                connectionManager.disconnect();
            }
            catch (ConnectionException e) {
                disconnectFailure = e;
            }
            state.set(State.STOPPED);
        }
        if (disconnectFailure != null) {
            throw new ShutdownException("Engine '" + config.getEngineName() + "' stopped but could not disconnect cleanly", disconnectFailure);
        }
        LOGGER.info("Engine '{}' stopped", config.getEngineName());
    }

    @Override
    public Status status() {
        return new Status(state.get(), accumulator.bufferedEventCount(), registry.subscribedTables(), registry.erroredTables());
    }

    @Override
    public CatchUpSequence readSince(String table, Instant watermark, int limit) {
        return catchUpReader.readSince(table, watermark, limit);
    }

    @Override
    public CatchUpSequence performInitialSync(String table, Instant lastSyncTime) {
        return catchUpReader.performInitialSync(table, lastSyncTime);
    }

    @Override
    public int catchUp(String table) {
        if (state.get() != State.RUNNING) {
            throw new IllegalStateException("Engine '" + config.getEngineName() + "' must be running to catch up, but is " + state.get());
        }
        if (!tables.contains(table)) {
            throw new IllegalArgumentException("Table '" + table + "' is not a watched table");
        }
        return queueCatchUp(table);
    }

    private int queueCatchUp(String table) {
        final Instant since = watermarks.watermark(table).orElse(null);
        int queued = 0;
        for (ChangeEvent event : catchUpReader.performInitialSync(table, since)) {
            accumulator.push(event);
            queued++;
        }
        LOGGER.info("Queued {} catch-up events of table '{}'", queued, table);
        return queued;
    }

    /**
     * Catch up a table on the catch-up thread. A request for a table whose catch-up is still waiting to run is merged
     * into it.
     */
    private void requestCatchUp(String table) {
        final ExecutorService executor = catchUpExecutor;
        if (executor == null) {
            LOGGER.warn("Engine '{}' is not running; table '{}' needs a catch-up after the next start", config.getEngineName(), table);
            return;
        }
        if (!requestedCatchUps.add(table)) {
            LOGGER.debug("Catch-up of table '{}' is already requested", table);
            return;
        }
        try {
            executor.execute(() -> {
                requestedCatchUps.remove(table);
                try {
                    queueCatchUp(table);
                }
                catch (RuntimeException e) {
                    LOGGER.warn("Requested catch-up of table '{}' failed", table, e);
                }
            });
        }
        catch (RejectedExecutionException e) {
            requestedCatchUps.remove(table);
            LOGGER.warn("Engine '{}' is stopping; table '{}' needs a catch-up after the next start", config.getEngineName(), table);
        }
    }

    /**
     * @return the latest delivered source commit time per table
     */
    public Map<String, Instant> watermarks() {
        return watermarks.snapshot();
    }

    @Override
    public String toString() {
        return "ChangeSyncEngine{name='" + config.getEngineName() + "', state=" + state.get() + "}";
    }

    /**
     * Builder of {@link ChangeSyncEngine} instances.
     */
    public static final class Builder {
        private Configuration config;
        private RealtimeTransport transport;
        private QueryConnectionPool pool;
        private HistoricalStore store;
        private BatchSink sink;
        private Clock clock = Clock.system();

        private Builder() {
        }

        public Builder using(Configuration config) {
            this.config = config;
            return this;
        }

        public Builder using(RealtimeTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder using(QueryConnectionPool pool) {
            this.pool = pool;
            return this;
        }

        /**
         * Read catch-up rows from the given store instead of querying the tables through the connection pool.
         */
        public Builder using(HistoricalStore store) {
            this.store = store;
            return this;
        }

        public Builder using(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder notifying(BatchSink sink) {
            this.sink = sink;
            return this;
        }

        /**
         * @return the new engine, in the {@link State#STOPPED} state
         * @throws SyncbaseException if the configuration is invalid
         * @throws NullPointerException if the configuration, transport, pool or sink is missing
         */
        public ChangeSyncEngine build() {
            Objects.requireNonNull(config, "A configuration is required");
            Objects.requireNonNull(transport, "A realtime transport is required");
            Objects.requireNonNull(pool, "A query connection pool is required");
            Objects.requireNonNull(sink, "A batch sink is required");
            Objects.requireNonNull(clock, "A clock is required");
            return new ChangeSyncEngine(this);
        }
    }
}
