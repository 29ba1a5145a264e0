package com.example.shiftplanner.constraint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Declared from most to least severe; {@link #compareTo} therefore sorts critical first.
 */
public enum Severity {
    CRITICAL("critical"),
    ERROR("error"),
    WARNING("warning"),
    INFO("info");

    private final String code;

    Severity(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isBlocking() {
        return this == CRITICAL || this == ERROR;
    }

    @JsonCreator
    public static Severity fromCode(String value) {
        for (Severity severity : values()) {
            if (severity.code.equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
