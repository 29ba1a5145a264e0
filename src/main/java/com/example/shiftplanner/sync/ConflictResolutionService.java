package com.example.shiftplanner.sync;

import com.example.shiftplanner.assignment.Assignment;
import com.example.shiftplanner.assignment.AssignmentDto;
import com.example.shiftplanner.assignment.AssignmentStatus;
import com.example.shiftplanner.assignment.AssignmentStore;
import com.example.shiftplanner.exception.ConflictException;
import com.example.shiftplanner.exception.ValidationException;
import com.example.shiftplanner.realtime.CollaborationHub;
import com.example.shiftplanner.shift.ShiftDemand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Applies a user's decision on a reported conflict and tells the session about it.
 */
@Service
public class ConflictResolutionService {

    private static final Logger logger = LoggerFactory.getLogger(ConflictResolutionService.class);

    public static final String DEFAULT_SESSION = "default";

    private final AssignmentStore assignmentStore;
    private final CollaborationHub hub;
    private final TransactionTemplate transaction;
    private final Clock clock;

    public ConflictResolutionService(AssignmentStore assignmentStore,
                                     CollaborationHub hub,
                                     PlatformTransactionManager transactionManager,
                                     Clock clock) {
        this.assignmentStore = assignmentStore;
        this.hub = hub;
        this.transaction = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public ConflictResolutionOutcome resolve(String conflictId, ResolveConflictRequest request, String userId) {
        ConflictResolution resolution = request.resolution();
        AssignmentDto resolved = resolution.resolvedAssignment();
        Instant now = clock.instant();

        AssignmentDto applied = switch (resolution.action()) {
            case ACCEPT_LOCAL -> resolved == null ? null : transaction.execute(status -> write(resolved, userId, now));
            case MERGE -> {
                if (resolved == null) {
                    throw new ValidationException("merge requires resolvedAssignment");
                }
                yield transaction.execute(status -> write(resolved, userId, now));
            }
            case ACCEPT_REMOTE -> resolved == null
                    ? null
                    : assignmentStore.findById(resolved.id()).map(AssignmentDto::from).orElse(null);
            case MANUAL -> null;
        };

        String sessionId = request.sessionId() == null || request.sessionId().isBlank()
                ? DEFAULT_SESSION
                : request.sessionId();
        hub.broadcastConflictResolved(sessionId, conflictId, resolution.action(), applied, userId);
        logger.info("Conflict {} resolved by {} with {}", conflictId, userId, resolution.action().getCode());
        return new ConflictResolutionOutcome(true, conflictId, resolution.action(), applied, now);
    }

    private AssignmentDto write(AssignmentDto dto, String userId, Instant now) {
        ShiftDemand demand = assignmentStore.findDemand(dto.demandId())
                .orElseThrow(() -> new ValidationException("Demand %s not found".formatted(dto.demandId())));
        if (AssignmentStatus.ACTIVE.contains(dto.statusOrDefault())) {
            List<Assignment> overlapping = assignmentStore.findConflicting(
                    dto.employeeId(), demand.getDate(), demand.window(), dto.id());
            if (!overlapping.isEmpty()) {
                throw new ConflictException("Employee %s is still double-booked by %s".formatted(dto.employeeId(),
                        overlapping.stream().map(Assignment::getId).toList()));
            }
        }
        return AssignmentDto.from(assignmentStore.upsert(dto, userId, now));
    }
}
