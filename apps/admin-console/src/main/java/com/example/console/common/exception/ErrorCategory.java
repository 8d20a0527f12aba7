package com.example.console.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable error categories surfaced to the console UI.
 */
public enum ErrorCategory {

    INVALID_INPUT("invalid_input", HttpStatus.BAD_REQUEST),
    INVALID_PARENT("invalid_parent", HttpStatus.UNPROCESSABLE_ENTITY),
    NOT_EDITABLE("not_editable", HttpStatus.CONFLICT),
    NOT_FOUND("not_found", HttpStatus.NOT_FOUND),
    CONFLICT("conflict", HttpStatus.CONFLICT),
    UNAVAILABLE("unavailable", HttpStatus.SERVICE_UNAVAILABLE),
    TIMEOUT("timeout", HttpStatus.GATEWAY_TIMEOUT);

    private final String error;
    private final HttpStatus httpStatus;

    ErrorCategory(String error, HttpStatus httpStatus) {
        this.error = error;
        this.httpStatus = httpStatus;
    }

    public String error() {
        return error;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }
}
