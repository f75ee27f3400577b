package com.webanalytics.funnel.model;

import org.springframework.http.HttpStatus;

/**
 * Failure categories surfaced by funnel analytics, with the HTTP status each maps to.
 */
public enum ErrorKind {
    FUNNEL_NOT_FOUND(HttpStatus.NOT_FOUND),
    INVALID_DEFINITION(HttpStatus.UNPROCESSABLE_ENTITY),
    INVALID_FILTER(HttpStatus.BAD_REQUEST),
    INVALID_DATE_RANGE(HttpStatus.BAD_REQUEST),
    DATABASE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    CANCELLED(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
