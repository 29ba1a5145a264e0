package com.example.shiftplanner.constraint.rules;

import com.example.shiftplanner.assignment.AssignmentSlot;
import com.example.shiftplanner.constraint.ConstraintViolation;
import com.example.shiftplanner.constraint.EvaluationContext;
import com.example.shiftplanner.constraint.PlanningRule;
import com.example.shiftplanner.constraint.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class DoubleBookingRule implements PlanningRule {

    public static final String ID = "double-booking";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ConstraintViolation> evaluate(List<AssignmentSlot> slots, EvaluationContext context) {
        Set<String> evaluated = Timelines.ids(slots);
        List<ConstraintViolation> violations = new ArrayList<>();
        for (Map.Entry<String, List<AssignmentSlot>> entry : Timelines.byEmployee(slots, context).entrySet()) {
            List<AssignmentSlot> timeline = entry.getValue();
            for (int i = 0; i < timeline.size(); i++) {
                for (int j = i + 1; j < timeline.size(); j++) {
                    AssignmentSlot a = timeline.get(i);
                    AssignmentSlot b = timeline.get(j);
                    if (!a.date().equals(b.date()) || !a.window().overlaps(b.window())) {
                        continue;
                    }
                    List<AssignmentSlot> pair = List.of(a, b);
                    if (!Timelines.touches(pair, evaluated)) {
                        continue;
                    }
                    violations.add(new ConstraintViolation(ID, Severity.CRITICAL,
                            "Employee %s is double-booked on %s".formatted(entry.getKey(), a.date()),
                            Timelines.idList(pair),
                            List.of("Reassign one of the overlapping shifts", "Review shift times")));
                }
            }
        }
        return violations;
    }
}
