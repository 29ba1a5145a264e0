package com.example.shiftplanner.constraint;

import com.example.shiftplanner.assignment.AssignmentSlot;

import java.util.List;

/**
 * One family of checks. Implementations must not mutate the slots or the context.
 */
public interface PlanningRule {

    String id();

    /**
     * @param slots active assignments under evaluation, each joined with its demand
     */
    List<ConstraintViolation> evaluate(List<AssignmentSlot> slots, EvaluationContext context);
}
