package com.warehouse.service;

/**
 * Base type for failures that map to a fixed {@link ErrorKind}.
 */
public abstract class WarehouseException extends RuntimeException {

    protected WarehouseException(String message) {
        super(message);
    }

    protected WarehouseException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return category used to pick the HTTP status
     */
    public abstract ErrorKind getKind();
}
