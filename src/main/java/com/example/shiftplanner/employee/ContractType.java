package com.example.shiftplanner.employee;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ContractType {
    FULL_TIME("full_time"),
    PART_TIME("part_time"),
    TEMPORARY("temporary"),
    CONTRACT("contract");

    private final String code;

    ContractType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ContractType fromCode(String value) {
        for (ContractType type : values()) {
            if (type.code.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown contract type: " + value);
    }
}
