package com.example.shiftplanner.exception;

import org.springframework.http.HttpStatus;

/**
 * Base class for failures that map onto a client-visible HTTP status.
 */
public class BusinessException extends RuntimeException {

    private final String errorCode;
    private final HttpStatus status;
    private final Object[] parameters;

    public BusinessException(String errorCode, HttpStatus status, String message, Object... parameters) {
        super(message);
        this.errorCode = errorCode;
        this.status = status;
        this.parameters = parameters;
    }

    public BusinessException(String errorCode, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.status = status;
        this.parameters = new Object[0];
    }

    public String getErrorCode() {
        return errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public Object[] getParameters() {
        return parameters;
    }
}
