package com.example.shiftplanner.plan;

/**
 * Relative weight of each scoring component. Only the ratios matter.
 */
public record ScoreWeights(double skill, double availability, double fairness, double preference, double continuity) {

    public double total() {
        return skill + availability + fairness + preference + continuity;
    }

    public ScoreWeights plus(ScoreComponent component, double weight) {
        return switch (component) {
            case SKILL -> new ScoreWeights(skill + weight, availability, fairness, preference, continuity);
            case AVAILABILITY -> new ScoreWeights(skill, availability + weight, fairness, preference, continuity);
            case FAIRNESS -> new ScoreWeights(skill, availability, fairness + weight, preference, continuity);
            case PREFERENCE -> new ScoreWeights(skill, availability, fairness, preference + weight, continuity);
            case CONTINUITY -> new ScoreWeights(skill, availability, fairness, preference, continuity + weight);
        };
    }

    public enum ScoreComponent {
        SKILL, AVAILABILITY, FAIRNESS, PREFERENCE, CONTINUITY
    }
}
