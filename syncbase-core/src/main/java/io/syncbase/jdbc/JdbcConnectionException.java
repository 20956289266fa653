/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.jdbc;

import java.sql.SQLException;

import io.syncbase.SyncbaseException;

/**
 * Raised for {@link SQLException}s that cannot be handled locally; retains the SQL state and error code of the original
 * exception.
 */
public final class JdbcConnectionException extends SyncbaseException {

    private static final long serialVersionUID = 1L;

    private final String sqlState;
    private final int errorCode;

    public JdbcConnectionException(SQLException e) {
        this(e.getMessage(), e);
    }

    public JdbcConnectionException(String message, SQLException e) {
        super(message, e);
        this.sqlState = e.getSQLState();
        this.errorCode = e.getErrorCode();
    }

    /**
     * @return the SQL state of the original exception
     * @see SQLException#getSQLState()
     */
    public String getSqlState() {
        return sqlState;
    }

    /**
     * @return the vendor error code of the original exception
     * @see SQLException#getErrorCode()
     */
    public int getErrorCode() {
        return errorCode;
    }
}
