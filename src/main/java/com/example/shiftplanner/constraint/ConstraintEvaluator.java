package com.example.shiftplanner.constraint;

import com.example.shiftplanner.assignment.Assignment;
import com.example.shiftplanner.assignment.AssignmentSlot;
import com.example.shiftplanner.constraint.rules.*;
import com.example.shiftplanner.shift.ShiftDemand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Checks a set of assignments against every planning rule and returns the findings
 * as data. Results are grouped by rule, in rule order, most severe first within a group.
 */
@Component
public class ConstraintEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintEvaluator.class);

    public static final String DATA_INTEGRITY = "data-integrity";

    private final List<PlanningRule> rules;

    public ConstraintEvaluator() {
        this(defaultRules());
    }

    public ConstraintEvaluator(List<PlanningRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static List<PlanningRule> defaultRules() {
        return List.of(
                new SkillMatchingRule(),
                new AvailabilityRule(),
                new DoubleBookingRule(),
                new LaborLawRule(),
                new NightShiftRule(),
                new WeekendWorkRule(),
                new FairnessRule()
        );
    }

    public List<ConstraintViolation> evaluate(Collection<Assignment> assignments, EvaluationContext context) {
        List<ConstraintViolation> result = new ArrayList<>();
        evaluateGrouped(assignments, context).values().forEach(result::addAll);
        return result;
    }

    public Map<String, List<ConstraintViolation>> evaluateGrouped(Collection<Assignment> assignments,
                                                                  EvaluationContext context) {
        Map<String, List<ConstraintViolation>> grouped = new LinkedHashMap<>();
        List<AssignmentSlot> slots = new ArrayList<>();
        List<ConstraintViolation> integrity = new ArrayList<>();
        for (Assignment assignment : assignments) {
            if (!assignment.isActive()) {
                continue;
            }
            Optional<ShiftDemand> demand = context.demand(assignment.getDemandId());
            if (demand.isEmpty()) {
                integrity.add(new ConstraintViolation(DATA_INTEGRITY, Severity.ERROR,
                        "Assignment %s references unknown demand %s".formatted(assignment.getId(), assignment.getDemandId()),
                        List.of(assignment.getId()),
                        List.of("Review assignment data")));
                continue;
            }
            slots.add(new AssignmentSlot(assignment, demand.get()));
        }
        slots.sort(Comparator.comparing((AssignmentSlot s) -> s.date()).thenComparing(s -> s.assignment().getId()));
        List<AssignmentSlot> view = Collections.unmodifiableList(slots);

        for (PlanningRule rule : rules) {
            List<ConstraintViolation> found;
            try {
                found = new ArrayList<>(rule.evaluate(view, context));
            } catch (RuntimeException e) {
                logger.warn("Rule {} failed during evaluation", rule.id(), e);
                found = new ArrayList<>(List.of(new ConstraintViolation(rule.id(), Severity.INFO,
                        "Rule %s could not be evaluated: %s".formatted(rule.id(), e.getMessage()),
                        List.of(), List.of("Review rule configuration"))));
            }
            if (found.isEmpty()) {
                continue;
            }
            found.sort(Comparator.comparing(ConstraintViolation::severity));
            grouped.computeIfAbsent(rule.id(), k -> new ArrayList<>()).addAll(found);
        }
        if (!integrity.isEmpty()) {
            grouped.put(DATA_INTEGRITY, integrity);
        }
        return grouped;
    }
}
