package com.example.shiftplanner.plan;

import com.example.shiftplanner.exception.ValidationException;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Extra weight added to one scoring component for a single generation run.
 */
public record CustomConstraint(
        @NotBlank(message = "Constraint name is required") String name,
        @NotBlank(message = "Constraint rule is required") String rule,
        double weight
) {
    private static final Map<String, ScoreWeights.ScoreComponent> RULES = Map.of(
            "prefer_skill", ScoreWeights.ScoreComponent.SKILL,
            "prefer_fairness", ScoreWeights.ScoreComponent.FAIRNESS,
            "prefer_continuity", ScoreWeights.ScoreComponent.CONTINUITY,
            "prefer_preference", ScoreWeights.ScoreComponent.PREFERENCE,
            "avoid_overtime", ScoreWeights.ScoreComponent.AVAILABILITY
    );

    public ScoreWeights applyTo(ScoreWeights weights) {
        ScoreWeights.ScoreComponent component = rule == null ? null : RULES.get(rule.toLowerCase());
        if (component == null) {
            throw new ValidationException("Unknown custom constraint rule: " + rule, rule);
        }
        if (weight < 0) {
            throw new ValidationException("Custom constraint weight must not be negative: " + name, name);
        }
        return weights.plus(component, weight);
    }
}
