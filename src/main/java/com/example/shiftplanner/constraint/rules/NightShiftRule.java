package com.example.shiftplanner.constraint.rules;

import com.example.shiftplanner.assignment.AssignmentSlot;
import com.example.shiftplanner.constraint.ConstraintViolation;
import com.example.shiftplanner.constraint.EvaluationContext;
import com.example.shiftplanner.constraint.LaborLimits;
import com.example.shiftplanner.constraint.PlanningRule;
import com.example.shiftplanner.constraint.Severity;
import com.example.shiftplanner.employee.Employee;
import com.example.shiftplanner.shift.ShiftType;

import java.time.LocalDate;
import java.util.*;

public class NightShiftRule implements PlanningRule {

    public static final String ID = "night-shift";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ConstraintViolation> evaluate(List<AssignmentSlot> slots, EvaluationContext context) {
        Set<String> evaluated = Timelines.ids(slots);
        List<ConstraintViolation> violations = new ArrayList<>();
        for (Map.Entry<String, List<AssignmentSlot>> entry : Timelines.byEmployee(slots, context).entrySet()) {
            Optional<Employee> employee = context.employee(entry.getKey());
            if (employee.isEmpty()) {
                continue;
            }
            LaborLimits limits = context.limitsFor(employee.get());
            List<AssignmentSlot> nights = entry.getValue().stream()
                    .filter(s -> s.demand().getShiftTemplate().getShiftType() == ShiftType.NIGHT)
                    .toList();
            if (nights.isEmpty()) {
                continue;
            }

            SortedSet<LocalDate> dates = new TreeSet<>();
            nights.forEach(s -> dates.add(s.date()));
            for (List<LocalDate> run : Timelines.consecutiveRuns(dates)) {
                List<AssignmentSlot> involved = nights.stream().filter(s -> run.contains(s.date())).toList();
                if (run.size() > limits.maxConsecutiveNights() && Timelines.touches(involved, evaluated)) {
                    violations.add(new ConstraintViolation(ID, Severity.ERROR,
                            "Employee %s works %d consecutive nights from %s, limit is %d"
                                    .formatted(entry.getKey(), run.size(), run.get(0), limits.maxConsecutiveNights()),
                            Timelines.idList(involved),
                            List.of("Swap with available employee", "Add recovery day after night block")));
                }
            }

            Map<LocalDate, List<AssignmentSlot>> byWeek = new TreeMap<>();
            nights.forEach(s -> byWeek.computeIfAbsent(Timelines.weekOf(s.date()), k -> new ArrayList<>()).add(s));
            byWeek.forEach((week, weekNights) -> {
                if (weekNights.size() > limits.maxNightsPerWeek() && Timelines.touches(weekNights, evaluated)) {
                    violations.add(new ConstraintViolation(ID, Severity.ERROR,
                            "Employee %s works %d nights in week of %s, limit is %d"
                                    .formatted(entry.getKey(), weekNights.size(), week, limits.maxNightsPerWeek()),
                            Timelines.idList(weekNights),
                            List.of("Reassign to available employee")));
                }
            });
        }
        return violations;
    }
}
