package com.example.shiftplanner.constraint;

import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Classifies evaluator output for callers: blocking or advisory, and whether a
 * suggested action is something the system can carry out on its own.
 */
@Component
public class ViolationReporter {

    private static final List<String> AUTO_PHRASES = List.of("reassign", "swap", "adjust");
    private static final List<String> MANUAL_PHRASES = List.of("contact", "approve", "review");

    public ViolationSummary summarize(List<ConstraintViolation> violations) {
        int critical = 0, error = 0, warning = 0, info = 0, auto = 0;
        for (ConstraintViolation v : violations) {
            switch (v.severity()) {
                case CRITICAL -> critical++;
                case ERROR -> error++;
                case WARNING -> warning++;
                case INFO -> info++;
            }
            if (isAutoResolvable(v)) {
                auto++;
            }
        }
        return new ViolationSummary(violations.size(), critical, error, warning, info, critical + error, auto);
    }

    public Map<String, List<ConstraintViolation>> groupByConstraint(List<ConstraintViolation> violations) {
        Map<String, List<ConstraintViolation>> grouped = new LinkedHashMap<>();
        for (ConstraintViolation v : violations) {
            grouped.computeIfAbsent(v.constraintId(), k -> new ArrayList<>()).add(v);
        }
        grouped.values().forEach(list -> list.sort(Comparator.comparing(ConstraintViolation::severity)));
        return grouped;
    }

    public List<ConstraintViolation> sortBySeverity(List<ConstraintViolation> violations) {
        List<ConstraintViolation> sorted = new ArrayList<>(violations);
        sorted.sort(Comparator.comparing(ConstraintViolation::severity));
        return sorted;
    }

    public boolean isBlocking(ConstraintViolation violation) {
        return violation.isBlocking();
    }

    public boolean hasBlocking(List<ConstraintViolation> violations) {
        return violations.stream().anyMatch(ConstraintViolation::isBlocking);
    }

    public boolean isAutoResolvable(ConstraintViolation violation) {
        return anyActionContains(violation, AUTO_PHRASES);
    }

    public boolean requiresManualReview(ConstraintViolation violation) {
        return anyActionContains(violation, MANUAL_PHRASES);
    }

    private static boolean anyActionContains(ConstraintViolation violation, List<String> phrases) {
        for (String action : violation.suggestedActions()) {
            String lower = action.toLowerCase(Locale.ROOT);
            for (String phrase : phrases) {
                if (lower.contains(phrase)) {
                    return true;
                }
            }
        }
        return false;
    }
}
