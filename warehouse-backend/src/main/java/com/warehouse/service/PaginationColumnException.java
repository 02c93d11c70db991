package com.warehouse.service;

/**
 * Thrown when the configured pagination column cannot be used against a table.
 */
public class PaginationColumnException extends WarehouseException {
    public PaginationColumnException(String message) {
        super(message);
    }

    public static PaginationColumnException notInTable(String column) {
        return new PaginationColumnException("Pagination column '" + column + "' not found in table columns");
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CONFIG_ERROR;
    }
}
