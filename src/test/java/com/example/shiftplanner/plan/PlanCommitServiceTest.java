package com.example.shiftplanner.plan;

import com.example.shiftplanner.PlanningTestData;
import com.example.shiftplanner.assignment.Assignment;
import com.example.shiftplanner.assignment.AssignmentDto;
import com.example.shiftplanner.assignment.AssignmentRepository;
import com.example.shiftplanner.assignment.AssignmentStatus;
import com.example.shiftplanner.exception.ConflictException;
import com.example.shiftplanner.exception.NotFoundException;
import com.example.shiftplanner.exception.ValidationException;
import com.example.shiftplanner.shift.ShiftTemplate;
import com.example.shiftplanner.station.Priority;
import com.example.shiftplanner.station.Station;
import com.example.shiftplanner.sync.ConflictType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static com.example.shiftplanner.PlanningFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Import(PlanningTestData.class)
class PlanCommitServiceTest {

    @Autowired
    private PlanGenerationService generationService;

    @Autowired
    private PlanCommitService commitService;

    @Autowired
    private AssignmentRepository assignmentRepository;

    @Autowired
    private PlanRepository planRepository;

    @Autowired
    private PlanningTestData data;

    private Station station;
    private ShiftTemplate midday;

    @BeforeEach
    void setUp() {
        data.clear();
        station = data.station(station("st-1", Priority.HIGH));
        ShiftTemplate early = data.template(early());
        ShiftTemplate late = data.template(late());
        midday = data.template(midday());
        data.demand("d-early", MONDAY, station, early, 1);
        data.demand("d-late", MONDAY, station, late, 1);
        data.employee("emp-1");
        data.employee("emp-2");
    }

    @Test
    void commitPlan_withoutIds_confirmsEveryProposedAssignment() {
        PlanProposal proposal = generate();
        assertThat(proposal.assignments()).hasSize(2);

        CommitResult result = commitService.commitPlan(proposal.id(), null, "lead");

        assertThat(result.committedAssignments()).hasSize(2)
                .allMatch(a -> a.status() == AssignmentStatus.CONFIRMED);
        assertThat(result.failures()).isEmpty();
        assertThat(result.committedBy()).isEqualTo("lead");
        Plan plan = planRepository.findById(proposal.id()).orElseThrow();
        assertThat(plan.getStatus()).isEqualTo(PlanStatus.COMMITTED);
        assertThat(plan.getCommittedBy()).isEqualTo("lead");
    }

    @Test
    void commitPlan_withSubset_rejectsUntargetedAssignments() {
        PlanProposal proposal = generate();
        String first = proposal.assignments().get(0).id();
        String second = proposal.assignments().get(1).id();

        CommitResult result = commitService.commitPlan(proposal.id(), List.of(first), "lead");

        assertThat(result.committedAssignments()).extracting(AssignmentDto::id).containsExactly(first);
        assertThat(assignmentRepository.findById(second).orElseThrow().getStatus()).isEqualTo(AssignmentStatus.REJECTED);
    }

    @Test
    void commitPlan_reportsUnknownAssignmentIds() {
        PlanProposal proposal = generate();
        String first = proposal.assignments().get(0).id();

        CommitResult result = commitService.commitPlan(proposal.id(), List.of(first, "ghost"), "lead");

        assertThat(result.committedAssignments()).hasSize(1);
        assertThat(result.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.assignmentId()).isEqualTo("ghost");
            assertThat(failure.code()).isEqualTo(CommitFailure.Code.NOT_FOUND);
        });
    }

    @Test
    void commitPlan_overlappingConfirmedShift_rejectsAssignmentWithConflict() {
        PlanProposal proposal = generate();
        AssignmentDto early = proposal.assignments().stream()
                .filter(a -> a.demandId().equals("d-early"))
                .findFirst().orElseThrow();
        data.demand("d-midday", MONDAY, station, midday, 1);
        data.assignment("manual-1", "d-midday", early.employeeId(), AssignmentStatus.CONFIRMED, NOW);

        CommitResult result = commitService.commitPlan(proposal.id(), null, "lead");

        assertThat(result.committedAssignments()).hasSize(1);
        assertThat(result.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.assignmentId()).isEqualTo(early.id());
            assertThat(failure.code()).isEqualTo(CommitFailure.Code.CONFLICT);
            assertThat(failure.conflictingAssignmentIds()).containsExactly("manual-1");
        });
        assertThat(result.conflicts()).singleElement().satisfies(conflict -> {
            assertThat(conflict.id()).isEqualTo("conflict-commit-" + early.id());
            assertThat(conflict.type()).isEqualTo(ConflictType.DOUBLE_BOOKING);
            assertThat(conflict.affectedAssignments()).containsExactly(early.id(), "manual-1");
        });
        Assignment stored = assignmentRepository.findById(early.id()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(AssignmentStatus.REJECTED);
    }

    @Test
    void commitPlan_twice_throwsConflict() {
        PlanProposal proposal = generate();
        commitService.commitPlan(proposal.id(), null, "lead");

        assertThatThrownBy(() -> commitService.commitPlan(proposal.id(), null, "lead"))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("already been committed");
    }

    @Test
    void commitPlan_withEmptyIdList_throwsValidation() {
        PlanProposal proposal = generate();

        assertThatThrownBy(() -> commitService.commitPlan(proposal.id(), List.of(), "lead"))
                .isInstanceOf(ValidationException.class);
        assertThat(planRepository.findById(proposal.id()).orElseThrow().getStatus()).isEqualTo(PlanStatus.DRAFT);
    }

    @Test
    void commitPlan_unknownPlan_throwsNotFound() {
        assertThatThrownBy(() -> commitService.commitPlan("plan-missing", null, "lead"))
                .isInstanceOf(NotFoundException.class);
    }

    private PlanProposal generate() {
        PlanGenerationRequest request = new PlanGenerationRequest(
                new PlanGenerationRequest.DateRange(MONDAY, MONDAY), null, null, "balanced", null);
        return generationService.generatePlan(request, "planner");
    }
}
