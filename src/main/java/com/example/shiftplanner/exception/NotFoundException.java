package com.example.shiftplanner.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends BusinessException {

    public NotFoundException(String message, Object... parameters) {
        super("NOT_FOUND", HttpStatus.NOT_FOUND, message, parameters);
    }

    public static NotFoundException of(String kind, String id) {
        return new NotFoundException(kind + " " + id + " not found", id);
    }
}
