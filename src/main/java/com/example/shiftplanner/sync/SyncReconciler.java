package com.example.shiftplanner.sync;

import com.example.shiftplanner.assignment.Assignment;
import com.example.shiftplanner.assignment.AssignmentDto;
import com.example.shiftplanner.assignment.AssignmentStatus;
import com.example.shiftplanner.assignment.AssignmentStore;
import com.example.shiftplanner.shift.ShiftDemand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies a batch of client changes in array order. Each change commits or rolls back
 * on its own; conflicts are reported as data and never thrown.
 */
@Service
public class SyncReconciler {

    private static final Logger logger = LoggerFactory.getLogger(SyncReconciler.class);

    private final AssignmentStore assignmentStore;
    private final TransactionTemplate perChangeTransaction;
    private final Clock clock;

    public SyncReconciler(AssignmentStore assignmentStore,
                          PlatformTransactionManager transactionManager,
                          Clock clock) {
        this.assignmentStore = assignmentStore;
        this.perChangeTransaction = new TransactionTemplate(transactionManager);
        this.perChangeTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    public SyncResponse sync(List<PlanningChange> changes, String userId) {
        List<ChangeResult> results = new ArrayList<>();
        List<Conflict> conflicts = new ArrayList<>();
        for (PlanningChange change : changes) {
            try {
                Outcome outcome = perChangeTransaction.execute(status -> apply(change, userId));
                if (outcome == null) {
                    continue;
                }
                if (outcome.conflict() != null) {
                    conflicts.add(outcome.conflict());
                } else {
                    results.add(outcome.result());
                }
            } catch (RuntimeException e) {
                logger.error("Failed to apply change {} ({} {})", change.id(), change.type(), change.assignment().id(), e);
                results.add(ChangeResult.failed(change, "Internal error while applying change"));
            }
        }
        if (conflicts.isEmpty()) {
            logger.info("Sync by {}: {} changes applied", userId, results.size());
        } else {
            logger.warn("Sync by {}: {} results, {} conflicts", userId, results.size(), conflicts.size());
        }
        return new SyncResponse(true, results.size(), conflicts.size(), results, conflicts);
    }

    private Outcome apply(PlanningChange change, String userId) {
        return switch (change.type()) {
            case ADD -> applyAdd(change, userId);
            case UPDATE -> applyUpdate(change);
            case DELETE -> applyDelete(change);
        };
    }

    private Outcome applyAdd(PlanningChange change, String userId) {
        AssignmentDto dto = change.assignment();
        if (assignmentStore.findById(dto.id()).isPresent()) {
            return Outcome.conflict(change, ConflictType.CONCURRENT_MODIFICATION, List.of(dto.id()),
                    "Assignment %s already exists".formatted(dto.id()));
        }
        Optional<ShiftDemand> demand = assignmentStore.findDemand(dto.demandId());
        if (demand.isEmpty()) {
            return Outcome.failed(change, "Demand %s not found".formatted(dto.demandId()));
        }
        Outcome doubleBooking = checkDoubleBooking(change, demand.get(), null);
        if (doubleBooking != null) {
            return doubleBooking;
        }
        Assignment created = assignmentStore.create(dto, userId, clock.instant());
        return Outcome.ok(change, created);
    }

    private Outcome applyUpdate(PlanningChange change) {
        AssignmentDto dto = change.assignment();
        Optional<Assignment> existing = assignmentStore.findById(dto.id());
        if (existing.isEmpty()) {
            return Outcome.conflict(change, ConflictType.CONCURRENT_MODIFICATION, List.of(dto.id()),
                    "Assignment %s not found for update".formatted(dto.id()));
        }
        Instant storedAt = existing.get().getUpdatedAt();
        if (storedAt != null && storedAt.isAfter(change.timestamp())) {
            return Outcome.conflict(change, ConflictType.CONCURRENT_MODIFICATION, List.of(dto.id()),
                    "Assignment %s was modified by another user".formatted(dto.id()));
        }
        Optional<ShiftDemand> demand = assignmentStore.findDemand(dto.demandId());
        if (demand.isEmpty()) {
            return Outcome.failed(change, "Demand %s not found".formatted(dto.demandId()));
        }
        Outcome doubleBooking = checkDoubleBooking(change, demand.get(), dto.id());
        if (doubleBooking != null) {
            return doubleBooking;
        }
        Assignment updated = assignmentStore.update(existing.get(), dto, clock.instant());
        return Outcome.ok(change, updated);
    }

    private Outcome applyDelete(PlanningChange change) {
        boolean removed = assignmentStore.delete(change.assignment().id());
        if (!removed) {
            logger.debug("Delete of absent assignment {} treated as no-op", change.assignment().id());
        }
        return new Outcome(ChangeResult.ok(change, null), null);
    }

    private Outcome checkDoubleBooking(PlanningChange change, ShiftDemand demand, String excludeId) {
        AssignmentDto dto = change.assignment();
        if (!AssignmentStatus.ACTIVE.contains(dto.statusOrDefault())) {
            return null;
        }
        List<Assignment> overlapping = assignmentStore.findConflicting(
                dto.employeeId(), demand.getDate(), demand.window(), excludeId);
        if (overlapping.isEmpty()) {
            return null;
        }
        List<String> affected = new ArrayList<>();
        affected.add(dto.id());
        overlapping.forEach(a -> affected.add(a.getId()));
        return Outcome.conflict(change, ConflictType.DOUBLE_BOOKING, affected,
                "Employee %s is already assigned during this shift on %s".formatted(dto.employeeId(), demand.getDate()));
    }

    record Outcome(ChangeResult result, Conflict conflict) {

        static Outcome ok(PlanningChange change, Assignment stored) {
            return new Outcome(ChangeResult.ok(change, AssignmentDto.from(stored)), null);
        }

        static Outcome failed(PlanningChange change, String error) {
            return new Outcome(ChangeResult.failed(change, error), null);
        }

        static Outcome conflict(PlanningChange change, ConflictType type, List<String> affected, String message) {
            return new Outcome(null, new Conflict("conflict-" + change.id(), type, affected, message));
        }
    }
}
