package com.example.shiftplanner.constraint.rules;

import com.example.shiftplanner.assignment.AssignmentSlot;
import com.example.shiftplanner.constraint.ConstraintViolation;
import com.example.shiftplanner.constraint.EvaluationContext;
import com.example.shiftplanner.constraint.PlanningRule;
import com.example.shiftplanner.constraint.Severity;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public class WeekendWorkRule implements PlanningRule {

    public static final String ID = "weekend-work";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ConstraintViolation> evaluate(List<AssignmentSlot> slots, EvaluationContext context) {
        List<ConstraintViolation> violations = new ArrayList<>();
        for (AssignmentSlot slot : slots) {
            if (!isWeekend(slot.date())) {
                continue;
            }
            String employeeId = slot.assignment().getEmployeeId();
            context.employee(employeeId)
                    .filter(e -> !context.limitsFor(e).weekendWorkAllowed())
                    .ifPresent(e -> violations.add(new ConstraintViolation(ID, Severity.ERROR,
                            "Employee %s may not work weekends (%s)".formatted(employeeId, slot.date()),
                            List.of(slot.assignment().getId()),
                            List.of("Swap with available employee"))));
        }
        return violations;
    }

    public static boolean isWeekend(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
