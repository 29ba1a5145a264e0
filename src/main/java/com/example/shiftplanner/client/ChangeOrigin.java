package com.example.shiftplanner.client;

import com.example.shiftplanner.sync.ChangeType;

/**
 * How a locally held assignment came to be: created on this client, or edited from server state.
 */
public enum ChangeOrigin {
    ADD(ChangeType.ADD),
    UPDATE(ChangeType.UPDATE);

    private final ChangeType changeType;

    ChangeOrigin(ChangeType changeType) {
        this.changeType = changeType;
    }

    public ChangeType getChangeType() {
        return changeType;
    }
}
