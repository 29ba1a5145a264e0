package com.example.shiftplanner.client;

import com.example.shiftplanner.assignment.AssignmentDto;

public record PersistenceError(Type type, String message, AssignmentDto assignment, boolean retryable) {

    public enum Type {
        NETWORK,
        VALIDATION,
        CONFLICT,
        SERVER,
        NOT_FOUND
    }

    public static PersistenceError network(String message) {
        return new PersistenceError(Type.NETWORK, message, null, true);
    }
}
