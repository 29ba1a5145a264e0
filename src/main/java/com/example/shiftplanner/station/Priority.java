package com.example.shiftplanner.station;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Priority {
    CRITICAL("critical", 4),
    HIGH("high", 3),
    MEDIUM("medium", 2),
    LOW("low", 1);

    private final String code;
    private final int weight;

    Priority(String code, int weight) {
        this.code = code;
        this.weight = weight;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getWeight() {
        return weight;
    }

    @JsonCreator
    public static Priority fromCode(String value) {
        for (Priority priority : values()) {
            if (priority.code.equalsIgnoreCase(value) || priority.name().equalsIgnoreCase(value)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + value);
    }
}
