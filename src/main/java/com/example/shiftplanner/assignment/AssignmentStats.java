package com.example.shiftplanner.assignment;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record AssignmentStats(
        LocalDate start,
        LocalDate end,
        long totalAssignments,
        Map<String, Long> byStatus,
        List<EmployeeWorkload> byEmployee,
        double totalHours,
        double averageScore
) {
    public record EmployeeWorkload(String employeeId, String employeeName, long count, double totalHours) {}
}
