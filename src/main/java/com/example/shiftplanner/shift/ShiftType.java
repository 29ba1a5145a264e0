package com.example.shiftplanner.shift;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ShiftType {
    DAY("day"),
    NIGHT("night"),
    SWING("swing"),
    WEEKEND("weekend");

    private final String code;

    ShiftType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ShiftType fromCode(String value) {
        for (ShiftType type : values()) {
            if (type.code.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown shift type: " + value);
    }
}
