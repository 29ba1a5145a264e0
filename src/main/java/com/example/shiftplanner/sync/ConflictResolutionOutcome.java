package com.example.shiftplanner.sync;

import com.example.shiftplanner.assignment.AssignmentDto;

import java.time.Instant;

public record ConflictResolutionOutcome(
        boolean success,
        String conflictId,
        ResolutionAction action,
        AssignmentDto assignment,
        Instant timestamp
) {}
