package com.example.shiftplanner.exception;

import org.springframework.http.HttpStatus;

public class ValidationException extends BusinessException {

    public ValidationException(String message, Object... parameters) {
        super("VALIDATION_ERROR", HttpStatus.BAD_REQUEST, message, parameters);
    }
}
