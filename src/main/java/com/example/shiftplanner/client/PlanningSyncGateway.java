package com.example.shiftplanner.client;

import com.example.shiftplanner.sync.*;

import java.time.LocalDate;
import java.util.List;

/**
 * Server calls used by {@link OptimisticPersistenceClient}. Implementations throw
 * {@link NetworkException} when the server is unreachable and {@link PersistenceException}
 * for any other failed call. A sync answered with conflicts is a normal return.
 */
public interface PlanningSyncGateway {

    SyncResponse sync(List<PlanningChange> changes);

    PlanningData loadPlanningData(LocalDate date);

    SnapshotDto createSnapshot(SnapshotDto snapshot);

    PlanningData restoreSnapshot(String snapshotId);

    ConflictResolutionOutcome resolveConflict(String conflictId, ResolveConflictRequest request);
}
