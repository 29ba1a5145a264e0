package com.example.shiftplanner.client;

public class AssignmentNotFoundException extends PersistenceException {

    private final String assignmentId;

    public AssignmentNotFoundException(String assignmentId) {
        super(PersistenceError.Type.NOT_FOUND, "Assignment " + assignmentId + " not found", false);
        this.assignmentId = assignmentId;
    }

    public String getAssignmentId() {
        return assignmentId;
    }
}
