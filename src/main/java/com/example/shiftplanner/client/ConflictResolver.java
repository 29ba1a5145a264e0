package com.example.shiftplanner.client;

import com.example.shiftplanner.sync.Conflict;
import com.example.shiftplanner.sync.ConflictResolution;

/**
 * Decides how a reported conflict should be settled. The answer is returned to the caller
 * of {@link OptimisticPersistenceClient#handleConflict}; submitting it to the server is a
 * separate {@link OptimisticPersistenceClient#resolveConflict} call.
 */
@FunctionalInterface
public interface ConflictResolver {

    ConflictResolution resolve(Conflict conflict);

    static ConflictResolver acceptLocal() {
        return conflict -> ConflictResolution.acceptLocal();
    }
}
