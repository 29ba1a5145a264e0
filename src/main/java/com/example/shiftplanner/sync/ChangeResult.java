package com.example.shiftplanner.sync;

import com.example.shiftplanner.assignment.AssignmentDto;

public record ChangeResult(
        String changeId,
        ChangeType type,
        String assignmentId,
        boolean success,
        String error,
        AssignmentDto assignment
) {
    public static ChangeResult ok(PlanningChange change, AssignmentDto stored) {
        return new ChangeResult(change.id(), change.type(), change.assignment().id(), true, null, stored);
    }

    public static ChangeResult failed(PlanningChange change, String error) {
        return new ChangeResult(change.id(), change.type(), change.assignment().id(), false, error, null);
    }
}
