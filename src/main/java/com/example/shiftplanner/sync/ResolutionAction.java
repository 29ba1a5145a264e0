package com.example.shiftplanner.sync;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ResolutionAction {
    ACCEPT_LOCAL("accept_local"),
    ACCEPT_REMOTE("accept_remote"),
    MERGE("merge"),
    MANUAL("manual");

    private final String code;

    ResolutionAction(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ResolutionAction fromCode(String value) {
        for (ResolutionAction action : values()) {
            if (action.code.equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown resolution action: " + value);
    }
}
