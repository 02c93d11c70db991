package com.warehouse.service;

/**
 * Thrown when the bearer credential is missing or does not match the configured API token.
 */
public class UnauthorizedException extends WarehouseException {
    public UnauthorizedException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.UNAUTHORIZED;
    }
}
