package com.example.shiftplanner.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Strategies change how candidates are ranked, never which candidates are feasible.
 */
public enum PlanningStrategy {
    BALANCED("balanced", new ScoreWeights(40, 20, 25, 10, 5)),
    FAIRNESS_FIRST("fairness_first", new ScoreWeights(25, 15, 45, 10, 5)),
    EFFICIENCY_FIRST("efficiency_first", new ScoreWeights(55, 25, 10, 5, 5)),
    CONTINUITY_FIRST("continuity_first", new ScoreWeights(30, 15, 20, 10, 25));

    private final String code;
    private final ScoreWeights weights;

    PlanningStrategy(String code, ScoreWeights weights) {
        this.code = code;
        this.weights = weights;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public ScoreWeights weights() {
        return weights;
    }

    /**
     * @return the matching strategy; {@code null} and "basic" mean balanced
     */
    @JsonCreator
    public static PlanningStrategy fromCode(String value) {
        if (value == null || value.isBlank() || "basic".equalsIgnoreCase(value)) {
            return BALANCED;
        }
        for (PlanningStrategy strategy : values()) {
            if (strategy.code.equalsIgnoreCase(value) || strategy.name().equalsIgnoreCase(value)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown planning strategy: " + value);
    }
}
