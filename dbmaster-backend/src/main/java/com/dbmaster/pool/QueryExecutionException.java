package com.dbmaster.pool;

import java.sql.SQLException;

/**
 * Thrown when a statement fails on the server (syntax, constraint, timeout).
 */
public class QueryExecutionException extends RuntimeException {
    private final String sqlState;
    private final int errorCode;

    public QueryExecutionException(String message) {
        super(message);
        this.sqlState = null;
        this.errorCode = 0;
    }

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
        if (cause instanceof SQLException sqlException) {
            this.sqlState = sqlException.getSQLState();
            this.errorCode = sqlException.getErrorCode();
        } else {
            this.sqlState = null;
            this.errorCode = 0;
        }
    }

    public String getSqlState() {
        return sqlState;
    }

    public int getErrorCode() {
        return errorCode;
    }
}
