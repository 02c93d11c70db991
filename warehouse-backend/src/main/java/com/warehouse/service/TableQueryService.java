package com.warehouse.service;

import com.warehouse.config.WarehouseConfig;
import com.warehouse.model.ColumnDescriptor;
import com.warehouse.model.PageResult;
import com.warehouse.util.JdbcValues;
import com.warehouse.util.Pagination;
import com.warehouse.util.SqlIdentifiers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds and runs the count and page queries for a single table.
 *
 * <p>Schema, table and pagination column are interpolated as quoted identifiers and must already
 * be confirmed by {@link SchemaIntrospector}. Every value (district, limit, offset) is bound.
 */
@Slf4j
@Service
public class TableQueryService {

    static final String DISTRICT_COLUMN = "district";

    private final DataSource dataSource;
    private final WarehouseConfig config;

    public TableQueryService(DataSource dataSource, WarehouseConfig config) {
        this.dataSource = dataSource;
        this.config = config;
    }

    /**
     * Fetch one page of rows and the total matching row count.
     *
     * @param schemaName catalog-confirmed schema
     * @param tableName catalog-confirmed table
     * @param columns the table's columns as returned by {@link SchemaIntrospector#getColumns}
     * @param districtFilter optional district value, ignored when the table has no district column
     * @param page 1-based page, values below 1 are treated as 1
     * @param pageSize rows per page, clamped to [1, 1000]
     * @return rows and total count
     * @throws PaginationColumnException if the configured pagination column is not usable on this table
     * @throws QueryExecutionException if either statement fails
     */
    public PageResult buildAndRun(String schemaName, String tableName, List<ColumnDescriptor> columns,
                                  String districtFilter, int page, int pageSize) {
        TableQuery query = buildQuery(schemaName, tableName, columns, districtFilter, page, pageSize);

        try (Connection conn = dataSource.getConnection()) {
            long totalCount;
            try (PreparedStatement ps = prepare(conn, query.countSql(), query.countParams());
                 ResultSet rs = ps.executeQuery()) {
                totalCount = rs.next() ? rs.getLong(1) : 0L;
            }

            List<Map<String, Object>> rows = new ArrayList<>();
            try (PreparedStatement ps = prepare(conn, query.dataSql(), query.dataParams());
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(JdbcValues.readRow(rs));
                }
            }

            log.debug("Fetched {} of {} rows from {}.{}", rows.size(), totalCount, schemaName, tableName);
            return new PageResult(rows, totalCount);
        } catch (SQLException e) {
            log.error("Data query failed for {}.{}: {} (SQLState: {})", schemaName, tableName, e.getMessage(), e.getSQLState());
            throw new QueryExecutionException("Error querying table data: " + e.getMessage(), e);
        }
    }

    /**
     * Build the statements without touching the database.
     */
    TableQuery buildQuery(String schemaName, String tableName, List<ColumnDescriptor> columns,
                          String districtFilter, int page, int pageSize) {
        String paginationColumn = config.paginationColumn();
        boolean hasPaginationColumn = false;
        boolean hasDistrictColumn = false;
        for (ColumnDescriptor column : columns) {
            if (column.name().equals(paginationColumn)) {
                hasPaginationColumn = true;
            }
            if (DISTRICT_COLUMN.equals(column.name())) {
                hasDistrictColumn = true;
            }
        }
        if (!hasPaginationColumn) {
            throw PaginationColumnException.notInTable(paginationColumn);
        }
        if (!SqlIdentifiers.isSafe(paginationColumn)) {
            throw new PaginationColumnException("Pagination column '" + paginationColumn + "' is not a valid identifier");
        }
        if (!SqlIdentifiers.isSafe(schemaName) || !SqlIdentifiers.isSafe(tableName)) {
            throw new QueryExecutionException("Invalid table identifier '" + schemaName + "." + tableName + "'");
        }

        String from = " FROM " + SqlIdentifiers.qualify(schemaName, tableName);
        StringBuilder where = new StringBuilder();
        List<Object> filterParams = new ArrayList<>(1);
        if (districtFilter != null && !districtFilter.isEmpty() && hasDistrictColumn) {
            where.append(" WHERE ").append(SqlIdentifiers.quote(DISTRICT_COLUMN)).append(" = ?");
            filterParams.add(districtFilter);
        }

        int limit = Pagination.clampPageSize(pageSize);
        long offset = Pagination.offset(page, limit);

        String countSql = "SELECT COUNT(*)" + from + where;
        String dataSql = "SELECT *" + from + where
                + " ORDER BY " + SqlIdentifiers.quote(paginationColumn)
                + " LIMIT ? OFFSET ?";

        List<Object> dataParams = new ArrayList<>(filterParams);
        dataParams.add(limit);
        dataParams.add(offset);
        return new TableQuery(dataSql, List.copyOf(dataParams), countSql, List.copyOf(filterParams));
    }

    private PreparedStatement prepare(Connection conn, String sql, List<Object> params) throws SQLException {
        PreparedStatement ps = conn.prepareStatement(sql);
        try {
            if (config.queryTimeoutSeconds() > 0) {
                ps.setQueryTimeout(config.queryTimeoutSeconds());
            }
            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
            return ps;
        } catch (SQLException e) {
            ps.close();
            throw e;
        }
    }
}
