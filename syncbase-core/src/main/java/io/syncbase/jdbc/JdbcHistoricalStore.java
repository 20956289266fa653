/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.jdbc;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.syncbase.catchup.HistoricalRow;
import io.syncbase.catchup.HistoricalStore;

/**
 * A {@link HistoricalStore} that queries the tables through a {@link QueryConnectionPool}. A row counts as changed
 * after the watermark when either its modification or its creation column is later than the watermark.
 *
 * @author Syncbase Authors
 */
public class JdbcHistoricalStore implements HistoricalStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcHistoricalStore.class);

    private static final String INVALID_DATETIME_STATE = "22007";
    private static final String CHANGED_SINCE_QUERY = "SELECT * FROM %s.%s WHERE %s > ? OR %s > ? ORDER BY COALESCE(%s, %s) ASC LIMIT ?";

    private final QueryConnectionPool pool;
    private final String schema;
    private final String createdColumn;
    private final String modifiedColumn;
    private final Set<PreparedStatement> activeStatements = ConcurrentHashMap.newKeySet();

    public JdbcHistoricalStore(QueryConnectionPool pool, String schema, String createdColumn, String modifiedColumn) {
        this.pool = pool;
        this.schema = schema;
        this.createdColumn = createdColumn;
        this.modifiedColumn = modifiedColumn;
    }

    String changedSinceQuery(String table) {
        final String modified = JdbcConnection.quoted(modifiedColumn);
        final String created = JdbcConnection.quoted(createdColumn);
        return String.format(CHANGED_SINCE_QUERY, JdbcConnection.quoted(schema), JdbcConnection.quoted(table),
                modified, created, modified, created);
    }

    @Override
    public List<HistoricalRow> fetchChangedSince(String table, Instant watermark, int limit) {
        final String sql = changedSinceQuery(table);
        LOGGER.debug("Reading at most {} rows of '{}' changed after {}", limit, table, watermark);
        try {
            return pool.withConnection(connection -> {
                try (PreparedStatement statement = connection.prepareStatement(sql)) {
                    activeStatements.add(statement);
                    try {
                        final Timestamp since = Timestamp.from(watermark);
                        statement.setTimestamp(1, since);
                        statement.setTimestamp(2, since);
                        statement.setInt(3, limit);
                        try (ResultSet rs = statement.executeQuery()) {
                            return readRows(rs);
                        }
                    }
                    finally {
                        activeStatements.remove(statement);
                    }
                }
            });
        }
        catch (SQLException e) {
            throw new JdbcConnectionException("Failed to read changes of table '" + table + "' since " + watermark, e);
        }
    }

    private List<HistoricalRow> readRows(ResultSet rs) throws SQLException {
        final ResultSetMetaData metadata = rs.getMetaData();
        final int columnCount = metadata.getColumnCount();
        final List<HistoricalRow> rows = new ArrayList<>();
        while (rs.next()) {
            final Map<String, Object> columns = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                columns.put(metadata.getColumnLabel(i), rs.getObject(i));
            }
            rows.add(new HistoricalRow(columns, toInstant(columns.get(createdColumn)), toInstant(columns.get(modifiedColumn))));
        }
        return rows;
    }

    /**
     * Converts a creation or modification column value. Values without a zone, such as {@code DATE} and
     * {@code TIMESTAMP WITHOUT TIME ZONE} columns, are read in the JVM's default zone, as the driver binds the watermark.
     */
    static Instant toInstant(Object value) throws SQLException {
        if (value == null) {
            return null;
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toInstant();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().atStartOfDay(ZoneId.systemDefault()).toInstant();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toInstant();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).atZone(ZoneId.systemDefault()).toInstant();
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay(ZoneId.systemDefault()).toInstant();
        }
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof java.util.Date && !(value instanceof java.sql.Time)) {
            return ((java.util.Date) value).toInstant();
        }
        throw new SQLException("Unsupported timestamp value of type " + value.getClass().getName(), INVALID_DATETIME_STATE);
    }

    @Override
    public void cancel() {
        for (PreparedStatement statement : activeStatements) {
            try {
                statement.cancel();
                LOGGER.info("Cancelled catch-up query");
            }
            catch (SQLException e) {
                LOGGER.warn("Failed to cancel catch-up query", e);
            }
        }
    }
}
