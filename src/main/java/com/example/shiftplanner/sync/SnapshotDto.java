package com.example.shiftplanner.sync;

import com.example.shiftplanner.assignment.AssignmentDto;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Wire form of a snapshot. On create, {@code id} and {@code assignments} are optional
 * and {@code version} is assigned by the server.
 */
public record SnapshotDto(
        String id,
        @NotNull(message = "Snapshot date is required") LocalDate date,
        List<@Valid AssignmentDto> assignments,
        Long version,
        Instant createdAt,
        String createdBy,
        List<Conflict> conflicts
) {}
