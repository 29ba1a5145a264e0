package com.example.shiftplanner.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PlanStatus {
    DRAFT("draft"),
    PENDING_APPROVAL("pending_approval"),
    APPROVED("approved"),
    COMMITTED("committed"),
    REJECTED("rejected"),
    ARCHIVED("archived");

    private final String code;

    PlanStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static PlanStatus fromCode(String value) {
        for (PlanStatus status : values()) {
            if (status.code.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown plan status: " + value);
    }
}
