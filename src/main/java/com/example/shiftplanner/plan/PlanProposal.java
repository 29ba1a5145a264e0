package com.example.shiftplanner.plan;

import com.example.shiftplanner.assignment.AssignmentDto;
import com.example.shiftplanner.constraint.ConstraintViolation;
import com.example.shiftplanner.constraint.ViolationSummary;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record PlanProposal(
        String id,
        String name,
        PlanStatus status,
        LocalDate startDate,
        LocalDate endDate,
        PlanningStrategy strategy,
        List<AssignmentDto> assignments,
        CoverageStatus coverage,
        List<ConstraintViolation> violations,
        ViolationSummary violationSummary,
        String explanation,
        Instant generatedAt,
        String generatedBy
) {}
