package com.example.shiftplanner.plan;

import java.util.List;

public record CommitFailure(String assignmentId, Code code, String message, List<String> conflictingAssignmentIds) {

    public enum Code {
        NOT_FOUND,
        ALREADY_COMMITTED,
        CONFLICT
    }
}
