package com.sqlstage.service;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLSyntaxErrorException;
import java.util.Set;

/**
 * Keeps pooled connections alive when a user statement fails for a statement-level reason.
 *
 * <p>Ad-hoc SQL regularly fails with syntax, permission or constraint errors. None of those say
 * anything about the health of the physical connection, so they must not evict it from the pool.
 */
public class HikariSqlExceptionOverride implements SQLExceptionOverride {

    /**
     * SQLSTATE classes that describe the statement rather than the connection:
     * 0A feature not supported, 22 data exception, 23 integrity constraint violation,
     * 42 syntax error or access rule violation.
     */
    private static final Set<String> STATEMENT_LEVEL_CLASSES = Set.of("0A", "22", "23", "42");

    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }

        if (sqlException instanceof SQLFeatureNotSupportedException
                || sqlException instanceof SQLSyntaxErrorException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState != null && sqlState.length() >= 2
                && STATEMENT_LEVEL_CLASSES.contains(sqlState.substring(0, 2))) {
            return Override.DO_NOT_EVICT;
        }

        return Override.CONTINUE_EVICT;
    }
}
