package com.example.shiftplanner.constraint.rules;

import com.example.shiftplanner.assignment.AssignmentSlot;
import com.example.shiftplanner.constraint.ConstraintViolation;
import com.example.shiftplanner.constraint.EvaluationContext;
import com.example.shiftplanner.constraint.LaborLimits;
import com.example.shiftplanner.constraint.PlanningRule;
import com.example.shiftplanner.constraint.Severity;
import com.example.shiftplanner.employee.Employee;

import java.time.Duration;
import java.time.LocalDate;
import java.util.*;

/**
 * Daily and weekly hours, rest between shifts and consecutive working days.
 */
public class LaborLawRule implements PlanningRule {

    public static final String ID = "labor-law";

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
            List<AssignmentSlot> timeline = entry.getValue();
            checkDailyHours(entry.getKey(), timeline, limits, evaluated, violations);
            checkWeeklyHours(entry.getKey(), timeline, limits, evaluated, violations);
            checkRest(entry.getKey(), timeline, limits, evaluated, violations);
            checkConsecutiveDays(entry.getKey(), timeline, limits, evaluated, violations);
        }
        return violations;
    }

    private void checkDailyHours(String employeeId, List<AssignmentSlot> timeline, LaborLimits limits,
                                 Set<String> evaluated, List<ConstraintViolation> out) {
        Map<LocalDate, List<AssignmentSlot>> byDate = new TreeMap<>();
        timeline.forEach(s -> byDate.computeIfAbsent(s.date(), k -> new ArrayList<>()).add(s));
        byDate.forEach((date, daySlots) -> {
            double hours = daySlots.stream().mapToDouble(s -> s.window().durationHours()).sum();
            if (hours > limits.maxHoursPerDay() && Timelines.touches(daySlots, evaluated)) {
                out.add(new ConstraintViolation(ID, Severity.CRITICAL,
                        "Employee %s works %.1fh on %s, limit is %dh".formatted(employeeId, hours, date, limits.maxHoursPerDay()),
                        Timelines.idList(daySlots),
                        List.of("Reassign to available employee", "Adjust shift length")));
            }
        });
    }

    private void checkWeeklyHours(String employeeId, List<AssignmentSlot> timeline, LaborLimits limits,
                                  Set<String> evaluated, List<ConstraintViolation> out) {
        Map<LocalDate, List<AssignmentSlot>> byWeek = new TreeMap<>();
        timeline.forEach(s -> byWeek.computeIfAbsent(Timelines.weekOf(s.date()), k -> new ArrayList<>()).add(s));
        byWeek.forEach((week, weekSlots) -> {
            double hours = weekSlots.stream().mapToDouble(s -> s.window().durationHours()).sum();
            if (hours > limits.maxHoursPerWeek() && Timelines.touches(weekSlots, evaluated)) {
                out.add(new ConstraintViolation(ID, Severity.ERROR,
                        "Employee %s works %.1fh in week of %s, limit is %dh".formatted(employeeId, hours, week, limits.maxHoursPerWeek()),
                        Timelines.idList(weekSlots),
                        List.of("Reassign to available employee", "Approve overtime")));
            }
        });
    }

    private void checkRest(String employeeId, List<AssignmentSlot> timeline, LaborLimits limits,
                           Set<String> evaluated, List<ConstraintViolation> out) {
        for (int i = 1; i < timeline.size(); i++) {
            AssignmentSlot prev = timeline.get(i - 1);
            AssignmentSlot next = timeline.get(i);
            Duration gap = Duration.between(prev.window().endOn(prev.date()), next.window().startOn(next.date()));
            // negative gaps are overlaps, reported as double booking
            if (gap.isNegative()) {
                continue;
            }
            double restHours = gap.toMinutes() / 60.0;
            List<AssignmentSlot> pair = List.of(prev, next);
            if (restHours < limits.minRestHours() && Timelines.touches(pair, evaluated)) {
                out.add(new ConstraintViolation(ID, Severity.CRITICAL,
                        "Employee %s has only %.1fh rest before %s, minimum is %dh"
                                .formatted(employeeId, restHours, next.date(), limits.minRestHours()),
                        Timelines.idList(pair),
                        List.of("Reassign to available employee", "Adjust shift start time")));
            }
        }
    }

    private void checkConsecutiveDays(String employeeId, List<AssignmentSlot> timeline, LaborLimits limits,
                                      Set<String> evaluated, List<ConstraintViolation> out) {
        SortedSet<LocalDate> dates = new TreeSet<>();
        timeline.forEach(s -> dates.add(s.date()));
        for (List<LocalDate> run : Timelines.consecutiveRuns(dates)) {
            if (run.size() <= limits.maxConsecutiveDays()) {
                continue;
            }
            List<AssignmentSlot> involved = timeline.stream().filter(s -> run.contains(s.date())).toList();
            if (!Timelines.touches(involved, evaluated)) {
                continue;
            }
            out.add(new ConstraintViolation(ID, Severity.WARNING,
                    "Employee %s works %d consecutive days from %s, limit is %d"
                            .formatted(employeeId, run.size(), run.get(0), limits.maxConsecutiveDays()),
                    Timelines.idList(involved),
                    List.of("Swap with available employee", "Review rest day placement")));
        }
    }
}
