package com.example.shiftplanner.assignment;

import com.example.shiftplanner.shift.ShiftDemand;
import com.example.shiftplanner.shift.ShiftWindow;

import java.time.LocalDate;
import java.util.List;

/**
 * An assignment joined with the demand slot it fills.
 */
public record AssignmentSlot(Assignment assignment, ShiftDemand demand) {

    public LocalDate date() {
        return demand.getDate();
    }

    public ShiftWindow window() {
        return demand.window();
    }

    static List<AssignmentSlot> fromRows(List<Object[]> rows) {
        return rows.stream()
                .map(row -> new AssignmentSlot((Assignment) row[0], (ShiftDemand) row[1]))
                .toList();
    }
}
