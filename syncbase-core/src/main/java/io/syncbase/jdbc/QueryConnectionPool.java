/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.jdbc;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import io.syncbase.annotation.ThreadSafe;
import io.syncbase.annotation.VisibleForTesting;

/**
 * A pool of JDBC connections for short-lived queries. Connections are only ever checked out for the duration of a
 * single {@link #withConnection(ConnectionCallback) callback} and are returned to the pool on every path.
 * <p>
 * The underlying {@link HikariDataSource} is created lazily on first use, so constructing a pool never touches the
 * database.
 *
 * @author Syncbase Authors
 */
@ThreadSafe
public class QueryConnectionPool implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryConnectionPool.class);

    private static final String VALIDATION_QUERY = "SELECT 1";
    private static final Duration MAX_IDLE_TIME = Duration.ofMinutes(10);

    /**
     * Work performed with a checked out connection.
     */
    @FunctionalInterface
    public interface ConnectionCallback<T> {
        T apply(Connection connection) throws SQLException;
    }

    private final String jdbcUrl;
    private final JdbcConfiguration config;
    private final int maxPoolSize;
    private final DataSource providedDataSource;
    private volatile HikariDataSource dataSource;

    public QueryConnectionPool(JdbcConfiguration config, String urlPattern, int defaultPort, int maxPoolSize) {
        this.config = config;
        this.jdbcUrl = JdbcConnection.connectionString(urlPattern, config, defaultPort);
        this.maxPoolSize = maxPoolSize;
        this.providedDataSource = null;
    }

    @VisibleForTesting
    public QueryConnectionPool(DataSource dataSource) {
        this.config = null;
        this.jdbcUrl = null;
        this.maxPoolSize = 0;
        this.providedDataSource = dataSource;
    }

    private DataSource dataSource() {
        if (providedDataSource != null) {
            return providedDataSource;
        }
        if (dataSource == null) {
            synchronized (this) {
                if (dataSource == null) {
                    HikariConfig hikari = new HikariConfig();
                    hikari.setJdbcUrl(jdbcUrl);
                    hikari.setUsername(config.getUser());
                    hikari.setPassword(config.getPassword());
                    hikari.setMaximumPoolSize(maxPoolSize);
                    hikari.setIdleTimeout(MAX_IDLE_TIME.toMillis());
                    hikari.setPoolName("syncbase-query-pool");
                    // fail on first checkout instead of at construction when the database is down
                    hikari.setInitializationFailTimeout(-1);
                    LOGGER.info("Creating query connection pool for {} with at most {} connections", jdbcUrl, maxPoolSize);
                    dataSource = new HikariDataSource(hikari);
                }
            }
        }
        return dataSource;
    }

    /**
     * Check out a connection, apply the callback and return the connection to the pool.
     *
     * @param callback the work to perform; may not be null
     * @return the callback's result
     * @throws SQLException if no connection could be obtained or the callback failed
     */
    public <T> T withConnection(ConnectionCallback<T> callback) throws SQLException {
        try (Connection connection = dataSource().getConnection()) {
            return callback.apply(connection);
        }
    }

    /**
     * Run a trivial round-trip query on a pooled connection.
     *
     * @throws SQLException if the database cannot be reached
     */
    public void validate() throws SQLException {
        withConnection(connection -> {
            try (Statement statement = connection.createStatement();
                    ResultSet rs = statement.executeQuery(VALIDATION_QUERY)) {
                if (!rs.next()) {
                    throw new SQLException("Validation query returned no rows");
                }
                return null;
            }
        });
    }

    /**
     * Close every pooled connection. The pool is recreated on the next checkout.
     */
    @Override
    public synchronized void close() {
        if (dataSource != null) {
            dataSource.close();
            dataSource = null;
            LOGGER.info("Query connection pool closed");
        }
    }
}
