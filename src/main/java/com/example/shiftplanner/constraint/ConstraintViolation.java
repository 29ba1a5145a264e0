package com.example.shiftplanner.constraint;

import java.util.List;

public record ConstraintViolation(
        String constraintId,
        Severity severity,
        String message,
        List<String> affectedAssignments,
        List<String> suggestedActions
) {
    public ConstraintViolation {
        affectedAssignments = affectedAssignments == null ? List.of() : List.copyOf(affectedAssignments);
        suggestedActions = suggestedActions == null ? List.of() : List.copyOf(suggestedActions);
    }

    public boolean isBlocking() {
        return severity.isBlocking();
    }
}
