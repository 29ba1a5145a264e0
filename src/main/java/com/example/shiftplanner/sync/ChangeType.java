package com.example.shiftplanner.sync;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ChangeType {
    ADD("add"),
    UPDATE("update"),
    DELETE("delete");

    private final String code;

    ChangeType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ChangeType fromCode(String value) {
        for (ChangeType type : values()) {
            if (type.code.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown change type: " + value);
    }
}
