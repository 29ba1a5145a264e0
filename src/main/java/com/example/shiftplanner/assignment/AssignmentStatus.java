package com.example.shiftplanner.assignment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

public enum AssignmentStatus {
    PROPOSED("proposed"),
    CONFIRMED("confirmed"),
    REJECTED("rejected");

    /** Statuses that take part in double-booking checks. */
    public static final Set<AssignmentStatus> ACTIVE = EnumSet.of(PROPOSED, CONFIRMED);

    private final String code;

    AssignmentStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static AssignmentStatus fromCode(String value) {
        for (AssignmentStatus status : values()) {
            if (status.code.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown assignment status: " + value);
    }
}
