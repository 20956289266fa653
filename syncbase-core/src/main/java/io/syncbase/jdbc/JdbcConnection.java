/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.jdbc;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.syncbase.SyncbaseException;
import io.syncbase.annotation.ThreadSafe;
import io.syncbase.config.Configuration;

/**
 * A long-lived JDBC connection that is established on demand and used for control operations such as listening for
 * notifications or installing triggers.
 *
 * @author Syncbase Authors
 */
public class JdbcConnection implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcConnection.class);

    private static final int CONNECTION_VALID_CHECK_TIMEOUT_IN_SEC = 3;
    private static final int WAIT_FOR_CLOSE_SECONDS = 10;
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*");

    /**
     * Establishes JDBC connections.
     */
    @FunctionalInterface
    @ThreadSafe
    public interface ConnectionFactory {
        /**
         * @param config the configuration with the connection settings
         * @return the JDBC connection; never null
         * @throws SQLException if the connection could not be established
         */
        Connection connect(JdbcConfiguration config) throws SQLException;
    }

    @FunctionalInterface
    public interface ResultSetMapper<T> {
        T apply(ResultSet rs) throws SQLException;
    }

    @FunctionalInterface
    public interface StatementPreparer {
        void accept(PreparedStatement statement) throws SQLException;
    }

    /**
     * Create a {@link ConnectionFactory} that replaces the variables {@code ${hostname}}, {@code ${port}} and
     * {@code ${dbname}} in the URL pattern with the configured values, and passes user and password as connection
     * properties.
     *
     * @param urlPattern the URL pattern; may not be null
     * @param defaultPort the port used when none is configured
     * @return the connection factory; never null
     */
    public static ConnectionFactory patternBasedFactory(String urlPattern, int defaultPort) {
        return config -> {
            final String url = connectionString(urlPattern, config, defaultPort);
            final Properties props = new Properties();
            if (config.getUser() != null) {
                props.setProperty("user", config.getUser());
            }
            if (config.getPassword() != null) {
                props.setProperty("password", config.getPassword());
            }
            LOGGER.trace("URL: {}", url);
            final Connection conn = DriverManager.getConnection(url, props);
            LOGGER.debug("Connected to {} as {}", url, config.getUser());
            return conn;
        };
    }

    /**
     * Build the JDBC URL for the configuration from a pattern.
     *
     * @param urlPattern the pattern with {@code ${hostname}}, {@code ${port}} and {@code ${dbname}} variables
     * @param config the connection settings; may not be null
     * @param defaultPort the port used when none is configured
     * @return the URL; never null
     */
    public static String connectionString(String urlPattern, JdbcConfiguration config, int defaultPort) {
        final String port = config.getPort() != null ? config.getPort() : Integer.toString(defaultPort);
        return urlPattern
                .replace("${" + JdbcConfiguration.HOSTNAME.name() + "}", Objects.toString(config.getHostname(), "localhost"))
                .replace("${" + JdbcConfiguration.PORT.name() + "}", port)
                .replace("${" + JdbcConfiguration.DATABASE.name() + "}", Objects.toString(config.getDatabase(), ""));
    }

    /**
     * Validate a plain SQL identifier and return it in double quotes.
     *
     * @param identifier the table, schema or column name
     * @return the quoted identifier; never null
     * @throws IllegalArgumentException if the name is not a plain identifier
     */
    public static String quoted(String identifier) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier '" + identifier + "'");
        }
        return '"' + identifier + '"';
    }

    private final JdbcConfiguration config;
    private final ConnectionFactory factory;
    private volatile Connection conn;

    public JdbcConnection(Configuration config, ConnectionFactory connectionFactory) {
        this.config = JdbcConfiguration.adapt(config);
        this.factory = connectionFactory;
    }

    public JdbcConfiguration config() {
        return config;
    }

    /**
     * Ensure a connection to the database is established.
     *
     * @return this object for chaining methods together
     * @throws SQLException if the connection could not be established
     */
    public JdbcConnection connect() throws SQLException {
        connection();
        return this;
    }

    public synchronized boolean isConnected() throws SQLException {
        if (conn == null) {
            return false;
        }
        return !conn.isClosed();
    }

    public synchronized boolean isValid() throws SQLException {
        return isConnected() && conn.isValid(CONNECTION_VALID_CHECK_TIMEOUT_IN_SEC);
    }

    public synchronized Connection connection() throws SQLException {
        if (!isConnected()) {
            conn = factory.connect(config);
            if (!isConnected()) {
                throw new SQLException("Unable to obtain a JDBC connection");
            }
        }
        return conn;
    }

    /**
     * Execute the SQL statements in order, in auto-commit mode.
     *
     * @param sqlStatements the statements; null entries are skipped
     * @return this object for chaining methods together
     * @throws SQLException if a statement fails
     */
    public synchronized JdbcConnection execute(String... sqlStatements) throws SQLException {
        try (Statement statement = connection().createStatement()) {
            for (String sqlStatement : sqlStatements) {
                if (sqlStatement != null) {
                    LOGGER.trace("executing '{}'", sqlStatement);
                    statement.execute(sqlStatement);
                }
            }
        }
        return this;
    }

    public synchronized <T> T queryAndMap(String query, ResultSetMapper<T> mapper) throws SQLException {
        Objects.requireNonNull(mapper, "Mapper must be provided");
        try (Statement statement = connection().createStatement();
                ResultSet resultSet = statement.executeQuery(query)) {
            return mapper.apply(resultSet);
        }
    }

    public synchronized <T> T prepareQueryAndMap(String preparedQueryString, StatementPreparer preparer, ResultSetMapper<T> mapper)
            throws SQLException {
        Objects.requireNonNull(mapper, "Mapper must be provided");
        try (PreparedStatement statement = connection().prepareStatement(preparedQueryString)) {
            preparer.accept(statement);
            try (ResultSet resultSet = statement.executeQuery()) {
                return mapper.apply(resultSet);
            }
        }
    }

    /**
     * Close the connection. A connection that does not close within a few seconds is aborted.
     */
    @Override
    public synchronized void close() throws SQLException {
        if (conn != null) {
            try {
                LOGGER.trace("Closing database connection");
                doClose();
            }
            finally {
                conn = null;
            }
        }
    }

    private void doClose() throws SQLException {
        final Connection toClose = conn;
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<Object> futureClose = executor.submit(() -> {
            toClose.close();
            LOGGER.info("Connection gracefully closed");
            return null;
        });
        try {
            futureClose.get(WAIT_FOR_CLOSE_SECONDS, TimeUnit.SECONDS);
        }
        catch (ExecutionException e) {
            if (e.getCause() instanceof SQLException) {
                throw (SQLException) e.getCause();
            }
            else if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new SyncbaseException(e.getCause());
        }
        catch (TimeoutException | InterruptedException e) {
            LOGGER.warn("Failed to close database connection by calling close(), attempting abort()");
            toClose.abort(Runnable::run);
        }
        finally {
            executor.shutdownNow();
        }
    }
}
