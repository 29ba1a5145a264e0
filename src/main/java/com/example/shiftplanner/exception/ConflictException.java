package com.example.shiftplanner.exception;

import org.springframework.http.HttpStatus;

/**
 * Concurrent modification, double booking or an already committed plan.
 */
public class ConflictException extends BusinessException {

    public ConflictException(String message, Object... parameters) {
        super("CONFLICT", HttpStatus.CONFLICT, message, parameters);
    }
}
