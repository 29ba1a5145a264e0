package com.example.shiftplanner.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String code;

    RiskLevel(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static RiskLevel fromCode(String value) {
        for (RiskLevel level : values()) {
            if (level.code.equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown risk level: " + value);
    }

    public static RiskLevel forCoverage(double percentage) {
        if (percentage >= 95.0) {
            return LOW;
        }
        if (percentage >= 85.0) {
            return MEDIUM;
        }
        if (percentage >= 70.0) {
            return HIGH;
        }
        return CRITICAL;
    }
}
