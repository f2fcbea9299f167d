package com.example.abac.exception;

import org.springframework.http.HttpStatus;

/**
 * Base type for all typed errors raised by the policy decision point.
 * Each subtype carries a stable error code and the HTTP status it maps to.
 */
public abstract class AbacException extends RuntimeException {

    private final String code;
    private final HttpStatus status;

    protected AbacException(String code, HttpStatus status, String message) {
        super(message);
        this.code = code;
        this.status = status;
    }

    protected AbacException(String code, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
