/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.connector.postgresql;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.syncbase.jdbc.JdbcConnection;

/**
 * Installs and removes the triggers that publish the changes of the watched tables as notifications.
 * <p>
 * Every watched table gets an {@code AFTER} row trigger calling a shared function that sends the row images as JSON
 * with {@code pg_notify} on the table's channel. Tables that have the modification time column also get a
 * {@code BEFORE UPDATE} trigger keeping that column current, which catch-up reads rely on.
 * <p>
 * PostgreSQL rejects notification payloads of 8000 bytes or more, and an error raised by the trigger would abort the
 * application's own write. A change whose row images do not fit is therefore published as a truncated notification
 * holding only the key column, which makes the engine catch up the table. If even that does not fit, the change is
 * not published and a warning is raised instead.
 *
 * @author Syncbase Authors
 */
public class PostgresReplicationSetup {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresReplicationSetup.class);

    static final String NOTIFY_FUNCTION = "syncbase_notify_change";
    static final String NOTIFY_TRIGGER = "syncbase_notify";
    static final String TOUCH_TRIGGER = "syncbase_touch";
    static final int MAX_PAYLOAD_BYTES = 8000;

    private static final String COLUMN_EXISTS = "SELECT 1 FROM information_schema.columns WHERE table_schema = ? AND table_name = ? AND column_name = ?";

    private final JdbcConnection connection;
    private final PostgresConnectorConfig config;

    public PostgresReplicationSetup(JdbcConnection connection, PostgresConnectorConfig config) {
        this.connection = connection;
        this.config = config;
    }

    /**
     * Install the triggers of the tables, replacing any previous version.
     *
     * @param tables the watched tables
     * @throws SQLException if a statement fails
     */
    public void install(Set<String> tables) throws SQLException {
        final String schema = config.getSchema();
        final String modifiedColumn = config.getModifiedColumn();
        connection.execute(notifyFunction(schema), touchFunction(schema, modifiedColumn));
        for (String table : tables) {
            connection.execute(notifyTrigger(schema, table, config.channelName(table), config.getKeyColumn()).toArray(new String[0]));
            if (hasColumn(schema, table, modifiedColumn)) {
                connection.execute(touchTrigger(schema, table, modifiedColumn).toArray(new String[0]));
            }
            else {
                LOGGER.warn("Table '{}' has no '{}' column; catch-up reads will only see inserted rows", table, modifiedColumn);
            }
            LOGGER.info("Installed notification trigger on '{}.{}' publishing to channel '{}'", schema, table, config.channelName(table));
        }
    }

    /**
     * Drop the notification triggers of the tables. The modification time triggers are kept.
     *
     * @param tables the watched tables
     * @throws SQLException if a statement fails
     */
    public void uninstall(Set<String> tables) throws SQLException {
        final String schema = config.getSchema();
        for (String table : tables) {
            connection.execute(dropTrigger(NOTIFY_TRIGGER, schema, table));
            LOGGER.info("Removed notification trigger from '{}.{}'", schema, table);
        }
    }

    private boolean hasColumn(String schema, String table, String column) throws SQLException {
        return connection.prepareQueryAndMap(COLUMN_EXISTS, ps -> {
            ps.setString(1, schema);
            ps.setString(2, table);
            ps.setString(3, column);
        }, rs -> rs.next());
    }

    static String notifyFunction(String schema) {
        return "CREATE OR REPLACE FUNCTION " + JdbcConnection.quoted(schema) + "." + NOTIFY_FUNCTION + "() RETURNS trigger AS $$\n"
                + "DECLARE\n"
                + "  payload text;\n"
                + "BEGIN\n"
                + "  payload := json_build_object(\n"
                + "    'type', TG_OP,\n"
                + "    'schema', TG_TABLE_SCHEMA,\n"
                + "    'table', TG_TABLE_NAME,\n"
                + "    'commit_timestamp', now(),\n"
                + "    'record', CASE WHEN TG_OP = 'DELETE' THEN NULL ELSE row_to_json(NEW) END,\n"
                + "    'old_record', CASE WHEN TG_OP = 'INSERT' THEN NULL ELSE row_to_json(OLD) END)::text;\n"
                + "  IF octet_length(payload) >= " + MAX_PAYLOAD_BYTES + " THEN\n"
                + "    payload := json_build_object(\n"
                + "      'type', TG_OP,\n"
                + "      'schema', TG_TABLE_SCHEMA,\n"
                + "      'table', TG_TABLE_NAME,\n"
                + "      'commit_timestamp', now(),\n"
                + "      'truncated', true,\n"
                + "      'record', CASE WHEN TG_OP = 'DELETE' THEN NULL ELSE json_build_object(TG_ARGV[1], row_to_json(NEW) -> TG_ARGV[1]) END,\n"
                + "      'old_record', CASE WHEN TG_OP = 'INSERT' THEN NULL ELSE json_build_object(TG_ARGV[1], row_to_json(OLD) -> TG_ARGV[1]) END)::text;\n"
                + "  END IF;\n"
                + "  IF octet_length(payload) >= " + MAX_PAYLOAD_BYTES + " THEN\n"
                + "    RAISE WARNING 'Change on %.% is too large to publish', TG_TABLE_SCHEMA, TG_TABLE_NAME;\n"
                + "  ELSE\n"
                + "    PERFORM pg_notify(TG_ARGV[0], payload);\n"
                + "  END IF;\n"
                + "  RETURN NULL;\n"
                + "END;\n"
                + "$$ LANGUAGE plpgsql";
    }

    static String touchFunction(String schema, String column) {
        return "CREATE OR REPLACE FUNCTION " + JdbcConnection.quoted(schema) + "." + touchFunctionName(column) + "() RETURNS trigger AS $$\n"
                + "BEGIN\n"
                + "  NEW." + JdbcConnection.quoted(column) + " = now();\n"
                + "  RETURN NEW;\n"
                + "END;\n"
                + "$$ LANGUAGE plpgsql";
    }

    static List<String> notifyTrigger(String schema, String table, String channel, String keyColumn) {
        // rejects channel and column names that are not plain identifiers
        JdbcConnection.quoted(channel);
        JdbcConnection.quoted(keyColumn);
        final List<String> statements = new ArrayList<>();
        statements.add(dropTrigger(NOTIFY_TRIGGER, schema, table));
        statements.add("CREATE TRIGGER " + NOTIFY_TRIGGER + " AFTER INSERT OR UPDATE OR DELETE ON " + qualified(schema, table)
                + " FOR EACH ROW EXECUTE FUNCTION " + JdbcConnection.quoted(schema) + "." + NOTIFY_FUNCTION + "('" + channel + "', '" + keyColumn + "')");
        return statements;
    }

    static List<String> touchTrigger(String schema, String table, String column) {
        final List<String> statements = new ArrayList<>();
        statements.add(dropTrigger(TOUCH_TRIGGER, schema, table));
        statements.add("CREATE TRIGGER " + TOUCH_TRIGGER + " BEFORE UPDATE ON " + qualified(schema, table)
                + " FOR EACH ROW EXECUTE FUNCTION " + JdbcConnection.quoted(schema) + "." + touchFunctionName(column) + "()");
        return statements;
    }

    static String dropTrigger(String trigger, String schema, String table) {
        return "DROP TRIGGER IF EXISTS " + trigger + " ON " + qualified(schema, table);
    }

    private static String touchFunctionName(String column) {
        // rejects column names that are not plain identifiers
        JdbcConnection.quoted(column);
        return "syncbase_touch_" + column.toLowerCase();
    }

    private static String qualified(String schema, String table) {
        return JdbcConnection.quoted(schema) + "." + JdbcConnection.quoted(table);
    }
}
