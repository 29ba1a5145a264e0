package com.example.shiftplanner.sync;

import com.example.shiftplanner.assignment.AssignmentDto;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * One client edit. {@code id} identifies the change, not the assignment.
 */
public record PlanningChange(
        @NotBlank(message = "Change id is required") String id,
        @NotNull(message = "Change type is required") ChangeType type,
        @NotNull(message = "Assignment is required") @Valid AssignmentDto assignment,
        @NotNull(message = "Timestamp is required") Instant timestamp
) {}
