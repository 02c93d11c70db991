package com.warehouse.service;

import org.springframework.http.HttpStatus;

/**
 * Failure categories raised by the data path, each bound to the HTTP status it is reported with.
 */
public enum ErrorKind {
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    CONFIG_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    QUERY_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
