package com.warehouse.service;

import com.warehouse.model.ColumnDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads table and column metadata from {@code information_schema}.
 */
@Slf4j
@Service
public class SchemaIntrospector {

    static final String COLUMNS_SQL = "SELECT column_name, data_type, is_nullable "
            + "FROM information_schema.columns "
            + "WHERE table_schema = ? AND table_name = ? "
            + "ORDER BY ordinal_position";

    static final String TABLE_EXISTS_SQL = "SELECT EXISTS ("
            + "SELECT 1 FROM information_schema.tables "
            + "WHERE table_schema = ? AND table_name = ?)";

    private final DataSource dataSource;

    public SchemaIntrospector(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * List the columns of a table in ordinal order.
     *
     * @param schemaName schema name, matched exactly
     * @param tableName table name, matched exactly
     * @return columns, empty if the catalog reports none
     * @throws QueryExecutionException if the catalog query fails
     */
    public List<ColumnDescriptor> getColumns(String schemaName, String tableName) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(COLUMNS_SQL)) {
            ps.setString(1, schemaName);
            ps.setString(2, tableName);
            try (ResultSet rs = ps.executeQuery()) {
                List<ColumnDescriptor> columns = new ArrayList<>();
                while (rs.next()) {
                    columns.add(new ColumnDescriptor(
                            rs.getString(1),
                            rs.getString(2),
                            "YES".equalsIgnoreCase(rs.getString(3))));
                }
                log.debug("Found {} columns for {}.{}", columns.size(), schemaName, tableName);
                return columns;
            }
        } catch (SQLException e) {
            log.error("Column lookup failed for {}.{}: {} (SQLState: {})", schemaName, tableName, e.getMessage(), e.getSQLState());
            throw new QueryExecutionException("Error fetching column information: " + e.getMessage(), e);
        }
    }

    /**
     * @param schemaName schema name, matched exactly
     * @param tableName table or view name, matched exactly
     * @return true if the catalog lists the table
     * @throws QueryExecutionException if the catalog query fails
     */
    public boolean tableExists(String schemaName, String tableName) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(TABLE_EXISTS_SQL)) {
            ps.setString(1, schemaName);
            ps.setString(2, tableName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        } catch (SQLException e) {
            log.error("Table existence check failed for {}.{}: {} (SQLState: {})", schemaName, tableName, e.getMessage(), e.getSQLState());
            throw new QueryExecutionException("Error checking table existence: " + e.getMessage(), e);
        }
    }
}
