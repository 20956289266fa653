/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.engine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.syncbase.SyncbaseException;
import io.syncbase.config.Configuration;
import io.syncbase.config.Field;

/**
 * The configuration of a {@link ChangeSyncEngine}.
 *
 * @author Syncbase Authors
 */
public class SyncEngineConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(SyncEngineConfig.class);

    public static final int DEFAULT_MAX_BATCH_SIZE = 100;
    public static final long DEFAULT_MAX_BATCH_AGE_MS = 30_000L;
    public static final long DEFAULT_CATCHUP_LOOKBACK_MS = Duration.ofHours(24).toMillis();
    public static final int DEFAULT_CATCHUP_MAX_ROWS = 1000;
    public static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 30_000L;

    public static final Field ENGINE_NAME = Field.create("name")
            .withDisplayName("Engine name")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH)
            .withDescription("Unique name of the engine, used in thread names and log messages.")
            .withDefault("syncbase");

    public static final Field TABLE_INCLUDE_LIST = Field.create("table.include.list")
            .withDisplayName("Include tables")
            .withType(Type.LIST)
            .withWidth(Width.LONG)
            .withImportance(Importance.HIGH)
            .withDescription("A comma-separated list of the tables whose changes are captured.")
            .required();

    public static final Field MAX_BATCH_SIZE = Field.create("max.batch.size")
            .withDisplayName("Change event batch size")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDescription("Maximum number of change events delivered to the sink in one batch. "
                    + "A batch is delivered as soon as this many events are buffered. Defaults to " + DEFAULT_MAX_BATCH_SIZE + ".")
            .withDefault(DEFAULT_MAX_BATCH_SIZE)
            .withValidation(Field::isPositiveInteger);

    public static final Field MAX_BATCH_AGE_MS = Field.create("max.batch.age.ms")
            .withDisplayName("Change event batch age (ms)")
            .withType(Type.LONG)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDescription("Time in milliseconds between two flushes of the buffered change events, bounding how long "
                    + "an event waits before delivery. Defaults to " + DEFAULT_MAX_BATCH_AGE_MS + " ms.")
            .withDefault(DEFAULT_MAX_BATCH_AGE_MS)
            .withValidation(Field::isPositiveLong);

    public static final Field CATCHUP_LOOKBACK_MS = Field.create("catchup.lookback.ms")
            .withDisplayName("Catch-up look-back window (ms)")
            .withType(Type.LONG)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDescription("How far back an initial sync reads when the table was never synchronized. Defaults to 24 hours.")
            .withDefault(DEFAULT_CATCHUP_LOOKBACK_MS)
            .withValidation(Field::isPositiveLong);

    public static final Field CATCHUP_MAX_ROWS = Field.create("catchup.max.rows")
            .withDisplayName("Catch-up row limit")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDescription("Maximum number of rows read by one initial sync. Defaults to " + DEFAULT_CATCHUP_MAX_ROWS + ".")
            .withDefault(DEFAULT_CATCHUP_MAX_ROWS)
            .withValidation(Field::isPositiveInteger);

    public static final Field CATCHUP_MODIFIED_COLUMN = Field.create("catchup.modified.column")
            .withDisplayName("Modification time column")
            .withType(Type.STRING)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDescription("The column holding the last modification time of a row.")
            .withDefault("updated_at");

    public static final Field CATCHUP_CREATED_COLUMN = Field.create("catchup.created.column")
            .withDisplayName("Creation time column")
            .withType(Type.STRING)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDescription("The column holding the creation time of a row.")
            .withDefault("created_at");

    public static final Field CATCHUP_KEY_COLUMN = Field.create("catchup.key.column")
            .withDisplayName("Primary key column")
            .withType(Type.STRING)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDescription("The primary key column of the watched tables, used to build idempotency keys.")
            .withDefault("id");

    public static final Field CATCHUP_ON_START = Field.create("catchup.on.start")
            .withDisplayName("Catch up on start")
            .withType(Type.BOOLEAN)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDescription("Whether every watched table is caught up, within the look-back window, once the engine is running.")
            .withDefault(false);

    public static final Field SHUTDOWN_TIMEOUT_MS = Field.create("shutdown.timeout.ms")
            .withDisplayName("Shutdown timeout (ms)")
            .withType(Type.LONG)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDescription("Maximum time in milliseconds that stopping the engine waits for buffered events to be delivered.")
            .withDefault(DEFAULT_SHUTDOWN_TIMEOUT_MS)
            .withValidation(Field::isPositiveLong);

    public static final Field CONNECTION_WAIT_TIMEOUT_MS = Field.create("connection.wait.timeout.ms")
            .withDisplayName("Connection wait timeout (ms)")
            .withType(Type.LONG)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDescription("Maximum time in milliseconds that starting the engine waits for the data source to become "
                    + "reachable. 0 fails on the first unsuccessful attempt.")
            .withDefault(0L)
            .withValidation(Field::isNonNegativeLong);

    public static final Field CONNECTION_WAIT_INTERVAL_MS = Field.create("connection.wait.interval.ms")
            .withDisplayName("Connection wait interval (ms)")
            .withType(Type.LONG)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDescription("Time in milliseconds between two connection attempts while waiting for the data source.")
            .withDefault(2000L)
            .withValidation(Field::isPositiveLong);

    public static final Field.Set ALL_FIELDS = Field.setOf(
            ENGINE_NAME,
            TABLE_INCLUDE_LIST,
            MAX_BATCH_SIZE,
            MAX_BATCH_AGE_MS,
            CATCHUP_LOOKBACK_MS,
            CATCHUP_MAX_ROWS,
            CATCHUP_MODIFIED_COLUMN,
            CATCHUP_CREATED_COLUMN,
            CATCHUP_KEY_COLUMN,
            CATCHUP_ON_START,
            SHUTDOWN_TIMEOUT_MS,
            CONNECTION_WAIT_TIMEOUT_MS,
            CONNECTION_WAIT_INTERVAL_MS);

    /**
     * @return the Kafka definition of the engine settings, for documentation and tooling
     */
    public static ConfigDef configDef() {
        ConfigDef config = new ConfigDef();
        Field.group(config, "Engine", ENGINE_NAME, TABLE_INCLUDE_LIST, SHUTDOWN_TIMEOUT_MS,
                CONNECTION_WAIT_TIMEOUT_MS, CONNECTION_WAIT_INTERVAL_MS);
        Field.group(config, "Batching", MAX_BATCH_SIZE, MAX_BATCH_AGE_MS);
        Field.group(config, "Catch-up", CATCHUP_LOOKBACK_MS, CATCHUP_MAX_ROWS, CATCHUP_MODIFIED_COLUMN,
                CATCHUP_CREATED_COLUMN, CATCHUP_KEY_COLUMN, CATCHUP_ON_START);
        return config;
    }

    private final Configuration config;

    /**
     * @param config the configuration; may not be null
     * @throws SyncbaseException if the configuration is not valid
     */
    public SyncEngineConfig(Configuration config) {
        this(config, ALL_FIELDS);
    }

    protected SyncEngineConfig(Configuration config, Field.Set fields) {
        final List<String> problems = new ArrayList<>();
        if (!config.validateAndRecord(fields, problems::add)) {
            problems.forEach(LOGGER::error);
            throw new SyncbaseException("The engine configuration is invalid: " + String.join("; ", problems));
        }
        this.config = config;
    }

    public Configuration getConfig() {
        return config;
    }

    public String getEngineName() {
        return config.getString(ENGINE_NAME);
    }

    public Set<String> getTables() {
        return new LinkedHashSet<>(config.getList(TABLE_INCLUDE_LIST));
    }

    public int getMaxBatchSize() {
        return config.getInteger(MAX_BATCH_SIZE);
    }

    public Duration getMaxBatchAge() {
        return config.getDuration(MAX_BATCH_AGE_MS);
    }

    public Duration getCatchUpLookback() {
        return config.getDuration(CATCHUP_LOOKBACK_MS);
    }

    public int getCatchUpMaxRows() {
        return config.getInteger(CATCHUP_MAX_ROWS);
    }

    public String getModifiedColumn() {
        return config.getString(CATCHUP_MODIFIED_COLUMN);
    }

    public String getCreatedColumn() {
        return config.getString(CATCHUP_CREATED_COLUMN);
    }

    public String getKeyColumn() {
        return config.getString(CATCHUP_KEY_COLUMN);
    }

    public boolean isCatchUpOnStart() {
        return config.getBoolean(CATCHUP_ON_START);
    }

    public Duration getShutdownTimeout() {
        return config.getDuration(SHUTDOWN_TIMEOUT_MS);
    }

    public Duration getConnectionWaitTimeout() {
        return config.getDuration(CONNECTION_WAIT_TIMEOUT_MS);
    }

    public Duration getConnectionWaitInterval() {
        return config.getDuration(CONNECTION_WAIT_INTERVAL_MS);
    }

    @Override
    public String toString() {
        return config.toString();
    }
}
