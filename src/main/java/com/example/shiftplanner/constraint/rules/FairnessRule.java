package com.example.shiftplanner.constraint.rules;

import com.example.shiftplanner.assignment.AssignmentSlot;
import com.example.shiftplanner.constraint.ConstraintViolation;
import com.example.shiftplanner.constraint.EvaluationContext;
import com.example.shiftplanner.constraint.PlanningRule;
import com.example.shiftplanner.constraint.Severity;
import com.example.shiftplanner.employee.Employee;

import java.util.*;

/**
 * Advisory only: never produces blocking violations.
 */
public class FairnessRule implements PlanningRule {

    public static final String ID = "fairness";
    static final double OVERLOAD_FACTOR = 1.5;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ConstraintViolation> evaluate(List<AssignmentSlot> slots, EvaluationContext context) {
        Map<String, List<String>> byEmployee = new TreeMap<>();
        for (AssignmentSlot slot : slots) {
            byEmployee.computeIfAbsent(slot.assignment().getEmployeeId(), k -> new ArrayList<>())
                    .add(slot.assignment().getId());
        }
        List<Employee> active = context.employees().stream()
                .filter(Employee::isActive)
                .sorted(Comparator.comparing(Employee::getId))
                .toList();
        if (active.isEmpty() || byEmployee.isEmpty()) {
            return List.of();
        }
        double mean = (double) slots.size() / active.size();
        int maxLoad = byEmployee.values().stream().mapToInt(List::size).max().orElse(0);

        List<ConstraintViolation> violations = new ArrayList<>();
        byEmployee.forEach((employeeId, ids) -> {
            if (ids.size() >= 2 && ids.size() > mean * OVERLOAD_FACTOR) {
                violations.add(new ConstraintViolation(ID, Severity.WARNING,
                        "Employee %s has %d assignments, average is %.1f".formatted(employeeId, ids.size(), mean),
                        ids,
                        List.of("Reassign some shifts to less loaded employees")));
            }
        });
        if (maxLoad >= 2) {
            for (Employee employee : active) {
                if (!byEmployee.containsKey(employee.getId())) {
                    violations.add(new ConstraintViolation(ID, Severity.INFO,
                            "Employee %s has no assignments".formatted(employee.getId()),
                            List.of(),
                            List.of("Consider assigning shifts to " + employee.getName())));
                }
            }
        }
        return violations;
    }
}
