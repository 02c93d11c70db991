package com.warehouse.service;

/**
 * Wraps a failed catalog lookup or data query. The message carries the driver's error text.
 */
public class QueryExecutionException extends WarehouseException {
    public QueryExecutionException(String message) {
        super(message);
    }

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.QUERY_ERROR;
    }
}
