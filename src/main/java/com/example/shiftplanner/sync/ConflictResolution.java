package com.example.shiftplanner.sync;

import com.example.shiftplanner.assignment.AssignmentDto;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record ConflictResolution(
        @NotNull(message = "Resolution action is required") ResolutionAction action,
        @Valid AssignmentDto resolvedAssignment
) {
    public static ConflictResolution acceptLocal() {
        return new ConflictResolution(ResolutionAction.ACCEPT_LOCAL, null);
    }
}
