package com.example.shiftplanner.sync;

import java.util.List;

/**
 * Produced by the server during sync or commit. Never retried automatically.
 */
public record Conflict(String id, ConflictType type, List<String> affectedAssignments, String message) {

    public Conflict {
        affectedAssignments = affectedAssignments == null ? List.of() : List.copyOf(affectedAssignments);
    }
}
