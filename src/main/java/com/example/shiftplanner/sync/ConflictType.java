package com.example.shiftplanner.sync;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConflictType {
    CONCURRENT_MODIFICATION("concurrent_modification"),
    DOUBLE_BOOKING("double_booking"),
    ABSENCE_OVERLAP("absence_overlap"),
    ASSIGNMENT_CONFLICT("assignment_conflict");

    private final String code;

    ConflictType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ConflictType fromCode(String value) {
        for (ConflictType type : values()) {
            if (type.code.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown conflict type: " + value);
    }
}
