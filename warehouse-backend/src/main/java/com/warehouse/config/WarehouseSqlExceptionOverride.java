package com.warehouse.config;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.Set;

/**
 * Keeps pooled connections alive when a statement fails for reasons that say nothing about the
 * connection itself.
 *
 * <p>A bad cast on the district filter (22xxx), a missing privilege or relation (42xxx) and an
 * unsupported feature (0Axxx) all leave the session usable.
 */
public class WarehouseSqlExceptionOverride implements SQLExceptionOverride {

    private static final Set<String> NON_FATAL_SQLSTATE_CLASSES = Set.of("0A", "22", "42");

    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }
        if (sqlException instanceof SQLFeatureNotSupportedException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState != null && sqlState.length() >= 2
                && NON_FATAL_SQLSTATE_CLASSES.contains(sqlState.substring(0, 2))) {
            return Override.DO_NOT_EVICT;
        }
        return Override.CONTINUE_EVICT;
    }
}
