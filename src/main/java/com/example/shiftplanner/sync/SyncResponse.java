package com.example.shiftplanner.sync;

import java.util.List;

public record SyncResponse(
        boolean success,
        int processed,
        int conflictCount,
        List<ChangeResult> results,
        List<Conflict> conflicts
) {
    public boolean hasConflicts() {
        return conflictCount > 0;
    }
}
