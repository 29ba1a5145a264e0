package com.example.shiftplanner.constraint;

public record ViolationSummary(
        int total,
        int critical,
        int error,
        int warning,
        int info,
        int blocking,
        int autoResolvable
) {
    public static ViolationSummary empty() {
        return new ViolationSummary(0, 0, 0, 0, 0, 0, 0);
    }
}
