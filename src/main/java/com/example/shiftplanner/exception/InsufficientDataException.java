package com.example.shiftplanner.exception;

import org.springframework.http.HttpStatus;

/**
 * Generation was asked to plan a scope with no open demand or no usable employees.
 */
public class InsufficientDataException extends BusinessException {

    public InsufficientDataException(String message, Object... parameters) {
        super("INSUFFICIENT_DATA", HttpStatus.BAD_REQUEST, message, parameters);
    }
}
