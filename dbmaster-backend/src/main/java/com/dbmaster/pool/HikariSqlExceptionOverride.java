package com.dbmaster.pool;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLDataException;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLSyntaxErrorException;

/**
 * Keeps pooled connections alive when a statement fails for reasons that say nothing about the
 * connection itself, so user query errors never poison pool state.
 *
 * <p>Statement-level SQLSTATE classes: {@code 0A} feature not supported, {@code 22} data exception,
 * {@code 23} integrity constraint, {@code 42} syntax or access rule, {@code 70100} statement
 * interrupted by {@code max_statement_time}.
 */
public class HikariSqlExceptionOverride implements SQLExceptionOverride {

    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }

        if (sqlException instanceof SQLFeatureNotSupportedException
                || sqlException instanceof SQLSyntaxErrorException
                || sqlException instanceof SQLIntegrityConstraintViolationException
                || sqlException instanceof SQLDataException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState == null) {
            return Override.CONTINUE_EVICT;
        }
        if (sqlState.startsWith("0A")
                || sqlState.startsWith("22")
                || sqlState.startsWith("23")
                || sqlState.startsWith("42")
                || "70100".equals(sqlState)) {
            return Override.DO_NOT_EVICT;
        }

        return Override.CONTINUE_EVICT;
    }
}
