package com.example.shiftplanner.plan;

import com.example.shiftplanner.assignment.AssignmentDto;
import com.example.shiftplanner.sync.Conflict;

import java.time.Instant;
import java.util.List;

public record CommitResult(
        String planId,
        List<AssignmentDto> committedAssignments,
        List<CommitFailure> failures,
        List<Conflict> conflicts,
        Instant committedAt,
        String committedBy
) {}
