package com.example.shiftplanner.plan;

import com.example.shiftplanner.assignment.Assignment;
import com.example.shiftplanner.assignment.AssignmentDto;
import com.example.shiftplanner.assignment.AssignmentRepository;
import com.example.shiftplanner.assignment.AssignmentStatus;
import com.example.shiftplanner.assignment.AssignmentStore;
import com.example.shiftplanner.exception.ConflictException;
import com.example.shiftplanner.exception.NotFoundException;
import com.example.shiftplanner.exception.ValidationException;
import com.example.shiftplanner.shift.ShiftDemand;
import com.example.shiftplanner.sync.Conflict;
import com.example.shiftplanner.sync.ConflictType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Promotes proposed assignments of a plan to confirmed. The plan row and each target
 * assignment are locked for the duration of the call, so two commits racing on the same
 * assignment serialize and the later one sees it already confirmed.
 */
@Service
public class PlanCommitService {

    private static final Logger logger = LoggerFactory.getLogger(PlanCommitService.class);

    private final PlanRepository planRepository;
    private final AssignmentRepository assignmentRepository;
    private final AssignmentStore assignmentStore;
    private final Clock clock;

    public PlanCommitService(PlanRepository planRepository,
                             AssignmentRepository assignmentRepository,
                             AssignmentStore assignmentStore,
                             Clock clock) {
        this.planRepository = planRepository;
        this.assignmentRepository = assignmentRepository;
        this.assignmentStore = assignmentStore;
        this.clock = clock;
    }

    @Transactional
    public CommitResult commitPlan(String planId, List<String> assignmentIds, String userId) {
        Plan plan = planRepository.findForUpdate(planId).orElseThrow(() -> NotFoundException.of("Plan", planId));
        if (plan.getStatus() == PlanStatus.COMMITTED) {
            throw new ConflictException("Plan %s has already been committed".formatted(planId), planId);
        }
        if (assignmentIds != null && assignmentIds.isEmpty()) {
            throw new ValidationException("assignmentIds must not be empty when provided");
        }

        List<String> targets = assignmentIds != null
                ? new ArrayList<>(new LinkedHashSet<>(assignmentIds))
                : assignmentRepository.findByPlanIdAndStatus(planId, AssignmentStatus.PROPOSED).stream()
                    .map(Assignment::getId)
                    .sorted()
                    .toList();

        Instant now = clock.instant();
        List<AssignmentDto> committed = new ArrayList<>();
        List<CommitFailure> failures = new ArrayList<>();
        List<Conflict> conflicts = new ArrayList<>();
        for (String id : targets) {
            Optional<Assignment> locked = assignmentRepository.findForUpdate(id);
            if (locked.isEmpty() || !planId.equals(locked.get().getPlanId())) {
                failures.add(new CommitFailure(id, CommitFailure.Code.NOT_FOUND,
                        "Assignment %s not found in plan %s".formatted(id, planId), List.of()));
                continue;
            }
            Assignment assignment = locked.get();
            if (assignment.getStatus() != AssignmentStatus.PROPOSED) {
                failures.add(new CommitFailure(id, CommitFailure.Code.ALREADY_COMMITTED,
                        "Assignment %s is %s, not proposed".formatted(id, assignment.getStatus().getCode()), List.of()));
                continue;
            }
            Optional<ShiftDemand> demand = assignmentStore.findDemand(assignment.getDemandId());
            if (demand.isEmpty()) {
                failures.add(new CommitFailure(id, CommitFailure.Code.NOT_FOUND,
                        "Demand %s of assignment %s not found".formatted(assignment.getDemandId(), id), List.of()));
                continue;
            }
            List<String> overlapping = assignmentStore
                    .findConflicting(assignment.getEmployeeId(), demand.get().getDate(), demand.get().window(), id)
                    .stream()
                    .filter(other -> other.getStatus() == AssignmentStatus.CONFIRMED)
                    .map(Assignment::getId)
                    .toList();
            if (!overlapping.isEmpty()) {
                assignment.setStatus(AssignmentStatus.REJECTED);
                assignment.setUpdatedAt(now);
                assignmentRepository.save(assignment);
                List<String> affected = new ArrayList<>();
                affected.add(id);
                affected.addAll(overlapping);
                failures.add(new CommitFailure(id, CommitFailure.Code.CONFLICT,
                        "Employee %s already holds an overlapping confirmed shift".formatted(assignment.getEmployeeId()),
                        overlapping));
                conflicts.add(new Conflict("conflict-commit-" + id, ConflictType.DOUBLE_BOOKING, affected,
                        "Assignment %s overlaps confirmed %s".formatted(id, String.join(", ", overlapping))));
                continue;
            }
            assignment.setStatus(AssignmentStatus.CONFIRMED);
            assignment.setUpdatedAt(now);
            // flush so later overlap queries in this call see the confirmation
            assignmentRepository.saveAndFlush(assignment);
            committed.add(AssignmentDto.from(assignment));
        }

        Set<String> targeted = new HashSet<>(targets);
        for (Assignment leftover : assignmentRepository.findByPlanIdAndStatus(planId, AssignmentStatus.PROPOSED)) {
            if (!targeted.contains(leftover.getId())) {
                leftover.setStatus(AssignmentStatus.REJECTED);
                leftover.setUpdatedAt(now);
            }
        }

        plan.setStatus(PlanStatus.COMMITTED);
        plan.setCommittedAt(now);
        plan.setCommittedBy(userId);
        planRepository.save(plan);

        logger.info("Committed plan {} by {}: {} confirmed, {} failed", planId, userId, committed.size(), failures.size());
        return new CommitResult(planId, committed, failures, conflicts, now, userId);
    }
}
