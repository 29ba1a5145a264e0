package com.example.shiftplanner.constraint.rules;

import com.example.shiftplanner.assignment.AssignmentSlot;
import com.example.shiftplanner.constraint.ConstraintViolation;
import com.example.shiftplanner.constraint.EvaluationContext;
import com.example.shiftplanner.constraint.PlanningRule;
import com.example.shiftplanner.constraint.Severity;
import com.example.shiftplanner.employee.Absence;
import com.example.shiftplanner.employee.Employee;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class AvailabilityRule implements PlanningRule {

    public static final String ID = "availability";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ConstraintViolation> evaluate(List<AssignmentSlot> slots, EvaluationContext context) {
        List<ConstraintViolation> violations = new ArrayList<>();
        for (AssignmentSlot slot : slots) {
            String employeeId = slot.assignment().getEmployeeId();
            List<String> affected = List.of(slot.assignment().getId());
            Optional<Employee> employee = context.employee(employeeId);
            if (employee.isEmpty()) {
                violations.add(new ConstraintViolation(ID, Severity.CRITICAL,
                        "Employee %s does not exist".formatted(employeeId),
                        affected, List.of("Reassign to available employee")));
                continue;
            }
            if (!employee.get().isActive()) {
                violations.add(new ConstraintViolation(ID, Severity.CRITICAL,
                        "Employee %s is inactive".formatted(employeeId),
                        affected, List.of("Reassign to available employee")));
            }
            Optional<Absence> absence = context.absenceOn(employeeId, slot.date());
            absence.ifPresent(a -> violations.add(new ConstraintViolation(ID, Severity.CRITICAL,
                    "Employee %s is absent (%s) on %s".formatted(employeeId, a.getType().name().toLowerCase(), slot.date()),
                    affected,
                    List.of("Reassign to available employee", "Contact employee to confirm availability"))));
        }
        return violations;
    }
}
