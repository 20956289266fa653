/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.connector.postgresql;

import java.time.Duration;

import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;

import io.syncbase.config.Configuration;
import io.syncbase.config.Field;
import io.syncbase.engine.SyncEngineConfig;
import io.syncbase.jdbc.JdbcConfiguration;
import io.syncbase.jdbc.JdbcConnection;
import io.syncbase.jdbc.QueryConnectionPool;

/**
 * The configuration of an engine capturing changes from PostgreSQL through {@code LISTEN/NOTIFY}.
 *
 * @author Syncbase Authors
 */
public class PostgresConnectorConfig extends SyncEngineConfig {

    public static final String URL_PATTERN = "jdbc:postgresql://${hostname}:${port}/${dbname}";
    public static final int DEFAULT_PORT = 5432;
    private static final String DATABASE_PREFIX = "database.";

    public static final Field HOSTNAME = Field.create(DATABASE_PREFIX + JdbcConfiguration.HOSTNAME.name())
            .withDisplayName("Hostname")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH)
            .withDescription("Resolvable hostname or IP address of the PostgreSQL server.")
            .required();

    public static final Field PORT = Field.create(DATABASE_PREFIX + JdbcConfiguration.PORT.name())
            .withDisplayName("Port")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.HIGH)
            .withDescription("Port of the PostgreSQL server.")
            .withDefault(DEFAULT_PORT)
            .withValidation(Field::isPositiveInteger);

    public static final Field USER = Field.create(DATABASE_PREFIX + JdbcConfiguration.USER.name())
            .withDisplayName("User")
            .withType(Type.STRING)
            .withWidth(Width.SHORT)
            .withImportance(Importance.HIGH)
            .withDescription("Name of the PostgreSQL user to connect as.")
            .required();

    public static final Field PASSWORD = Field.create(DATABASE_PREFIX + JdbcConfiguration.PASSWORD.name())
            .withDisplayName("Password")
            .withType(Type.PASSWORD)
            .withWidth(Width.SHORT)
            .withImportance(Importance.HIGH)
            .withDescription("Password of the PostgreSQL user.");

    public static final Field DATABASE_NAME = Field.create(DATABASE_PREFIX + JdbcConfiguration.DATABASE.name())
            .withDisplayName("Database")
            .withType(Type.STRING)
            .withWidth(Width.MEDIUM)
            .withImportance(Importance.HIGH)
            .withDescription("The name of the PostgreSQL database holding the watched tables.")
            .required();

    public static final Field SCHEMA = Field.create(DATABASE_PREFIX + JdbcConfiguration.SCHEMA.name())
            .withDisplayName("Schema")
            .withType(Type.STRING)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDescription("The schema holding the watched tables.")
            .withDefault("public");

    public static final Field POOL_SIZE = Field.create("database.pool.size")
            .withDisplayName("Query pool size")
            .withType(Type.INT)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDescription("Maximum number of pooled connections used for catch-up queries.")
            .withDefault(4)
            .withValidation(Field::isPositiveInteger);

    public static final Field CHANNEL_PREFIX = Field.create("notification.channel.prefix")
            .withDisplayName("Notification channel prefix")
            .withType(Type.STRING)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDescription("Prefix of the notification channel of each table; the channel of table 'foo' is '<prefix>foo'.")
            .withDefault("syncbase_");

    public static final Field POLL_INTERVAL_MS = Field.create("notification.poll.interval.ms")
            .withDisplayName("Notification poll interval (ms)")
            .withType(Type.LONG)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDescription("Time in milliseconds between two checks for pending notifications.")
            .withDefault(100L)
            .withValidation(Field::isPositiveLong);

    public static final Field REPLICATION_SETUP_ENABLED = Field.create("replication.setup.enabled")
            .withDisplayName("Install notification triggers")
            .withType(Type.BOOLEAN)
            .withWidth(Width.SHORT)
            .withImportance(Importance.MEDIUM)
            .withDescription("Whether the notification triggers of the watched tables, and the trigger maintaining their "
                    + "modification time column, are installed on connect.")
            .withDefault(true);

    public static final Field REPLICATION_TEARDOWN_ENABLED = Field.create("replication.teardown.enabled")
            .withDisplayName("Remove notification triggers")
            .withType(Type.BOOLEAN)
            .withWidth(Width.SHORT)
            .withImportance(Importance.LOW)
            .withDescription("Whether the notification triggers are dropped again when the connection is closed.")
            .withDefault(false);

    public static final Field.Set ALL_FIELDS = SyncEngineConfig.ALL_FIELDS.with(
            HOSTNAME,
            PORT,
            USER,
            PASSWORD,
            DATABASE_NAME,
            SCHEMA,
            POOL_SIZE,
            CHANNEL_PREFIX,
            POLL_INTERVAL_MS,
            REPLICATION_SETUP_ENABLED,
            REPLICATION_TEARDOWN_ENABLED);

    public PostgresConnectorConfig(Configuration config) {
        super(config, ALL_FIELDS);
    }

    public JdbcConfiguration getJdbcConfig() {
        return JdbcConfiguration.adapt(getConfig().subset(DATABASE_PREFIX, true));
    }

    public String getSchema() {
        return getConfig().getString(SCHEMA);
    }

    public int getPoolSize() {
        return getConfig().getInteger(POOL_SIZE);
    }

    public Duration getPollInterval() {
        return getConfig().getDuration(POLL_INTERVAL_MS);
    }

    public boolean isReplicationSetupEnabled() {
        return getConfig().getBoolean(REPLICATION_SETUP_ENABLED);
    }

    public boolean isReplicationTeardownEnabled() {
        return getConfig().getBoolean(REPLICATION_TEARDOWN_ENABLED);
    }

    /**
     * @param table the table
     * @return the name of the notification channel on which the changes of the table are published
     */
    public String channelName(String table) {
        return getConfig().getString(CHANNEL_PREFIX) + table;
    }

    public JdbcConnection createControlConnection() {
        return new JdbcConnection(getJdbcConfig(), JdbcConnection.patternBasedFactory(URL_PATTERN, DEFAULT_PORT));
    }

    public QueryConnectionPool createQueryPool() {
        return new QueryConnectionPool(getJdbcConfig(), URL_PATTERN, DEFAULT_PORT, getPoolSize());
    }
}
