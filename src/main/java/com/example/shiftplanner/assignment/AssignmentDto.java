package com.example.shiftplanner.assignment;

import jakarta.validation.constraints.NotBlank;

import java.time.Instant;

public record AssignmentDto(
        @NotBlank(message = "Assignment id is required") String id,
        @NotBlank(message = "Demand id is required") String demandId,
        @NotBlank(message = "Employee id is required") String employeeId,
        String planId,
        AssignmentStatus status,
        Double score,
        String explanation,
        Instant createdAt,
        String createdBy,
        Instant updatedAt
) {
    public static AssignmentDto from(Assignment a) {
        return new AssignmentDto(
                a.getId(),
                a.getDemandId(),
                a.getEmployeeId(),
                a.getPlanId(),
                a.getStatus(),
                a.getScore(),
                a.getExplanation(),
                a.getCreatedAt(),
                a.getCreatedBy(),
                a.getUpdatedAt()
        );
    }

    public AssignmentDto withScore(double newScore) {
        return new AssignmentDto(id, demandId, employeeId, planId, status, newScore, explanation,
                createdAt, createdBy, updatedAt);
    }

    public AssignmentDto withStatus(AssignmentStatus newStatus) {
        return new AssignmentDto(id, demandId, employeeId, planId, newStatus, score, explanation,
                createdAt, createdBy, updatedAt);
    }

    public AssignmentStatus statusOrDefault() {
        return status == null ? AssignmentStatus.PROPOSED : status;
    }
}
