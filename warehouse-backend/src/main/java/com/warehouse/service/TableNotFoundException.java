package com.warehouse.service;

/**
 * Thrown when the requested table is absent from the catalog or reports no columns.
 */
public class TableNotFoundException extends WarehouseException {

    public TableNotFoundException(String message) {
        super(message);
    }

    public static TableNotFoundException missingTable(String schemaName, String tableName) {
        return new TableNotFoundException("Table '" + schemaName + "." + tableName + "' not found");
    }

    public static TableNotFoundException noColumns(String schemaName, String tableName) {
        return new TableNotFoundException("No columns found for table '" + schemaName + "." + tableName + "'");
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.NOT_FOUND;
    }
}
