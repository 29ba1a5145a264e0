package com.example.shiftplanner.plan;

import com.example.shiftplanner.PlanningTestData;
import com.example.shiftplanner.assignment.AssignmentRepository;
import com.example.shiftplanner.assignment.AssignmentStatus;
import com.example.shiftplanner.exception.ConflictException;
import com.example.shiftplanner.exception.InsufficientDataException;
import com.example.shiftplanner.exception.NotFoundException;
import com.example.shiftplanner.exception.ValidationException;
import com.example.shiftplanner.shift.ShiftTemplate;
import com.example.shiftplanner.station.Priority;
import com.example.shiftplanner.station.Station;
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
class PlanGenerationServiceTest {

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

    @BeforeEach
    void setUp() {
        data.clear();
        Station station = data.station(station("st-1", Priority.HIGH));
        ShiftTemplate early = data.template(early());
        ShiftTemplate late = data.template(late());
        data.demand("d-early", MONDAY, station, early, 2);
        data.demand("d-late", MONDAY, station, late, 1);
        data.employee("emp-1");
        data.employee("emp-2");
        data.employee("emp-3");
    }

    @Test
    void generatePlan_fillsOpenDemandAndStoresDraft() {
        PlanProposal proposal = generationService.generatePlan(request(null), "planner");

        assertThat(proposal.id()).startsWith("plan-");
        assertThat(proposal.status()).isEqualTo(PlanStatus.DRAFT);
        assertThat(proposal.strategy()).isEqualTo(PlanningStrategy.BALANCED);
        assertThat(proposal.generatedBy()).isEqualTo("planner");
        assertThat(proposal.assignments()).hasSize(3)
                .allMatch(a -> a.status() == AssignmentStatus.PROPOSED)
                .allMatch(a -> proposal.id().equals(a.planId()));
        assertThat(proposal.coverage().coveragePercentage()).isEqualTo(100.0);
        assertThat(proposal.violations()).isEmpty();
        assertThat(assignmentRepository.findByPlanIdOrderByIdAsc(proposal.id())).hasSize(3);
    }

    @Test
    void generatePlan_skipsPositionsAlreadyFilled() {
        data.assignment("manual-1", "d-early", "emp-1", AssignmentStatus.CONFIRMED, NOW);

        PlanProposal proposal = generationService.generatePlan(request(null), "planner");

        assertThat(proposal.assignments()).hasSize(2);
        assertThat(proposal.assignments())
                .noneMatch(a -> a.employeeId().equals("emp-1") && a.demandId().equals("d-early"));
    }

    @Test
    void generatePlan_withUnknownStrategy_throwsValidation() {
        assertThatThrownBy(() -> generationService.generatePlan(request("random"), "planner"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("random");
    }

    @Test
    void generatePlan_withReversedRange_throwsValidation() {
        PlanGenerationRequest reversed = new PlanGenerationRequest(
                new PlanGenerationRequest.DateRange(MONDAY, MONDAY.minusDays(1)), null, null, null, null);

        assertThatThrownBy(() -> generationService.generatePlan(reversed, "planner"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void generatePlan_withTooLongRange_throwsValidation() {
        PlanGenerationRequest tooLong = new PlanGenerationRequest(
                new PlanGenerationRequest.DateRange(MONDAY, MONDAY.plusDays(62)), null, null, null, null);

        assertThatThrownBy(() -> generationService.generatePlan(tooLong, "planner"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("62");
    }

    @Test
    void generatePlan_withUnknownStation_throwsValidation() {
        PlanGenerationRequest scoped = new PlanGenerationRequest(
                new PlanGenerationRequest.DateRange(MONDAY, MONDAY), List.of("st-9"), null, null, null);

        assertThatThrownBy(() -> generationService.generatePlan(scoped, "planner"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void generatePlan_withoutDemand_throwsInsufficientData() {
        PlanGenerationRequest empty = new PlanGenerationRequest(
                new PlanGenerationRequest.DateRange(MONDAY.plusDays(7), MONDAY.plusDays(8)), null, null, null, null);

        assertThatThrownBy(() -> generationService.generatePlan(empty, "planner"))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void generatePlan_withUnknownCustomConstraint_throwsValidation() {
        PlanGenerationRequest custom = new PlanGenerationRequest(
                new PlanGenerationRequest.DateRange(MONDAY, MONDAY), null, null, null,
                List.of(new CustomConstraint("extra", "prefer_everything", 10)));

        assertThatThrownBy(() -> generationService.generatePlan(custom, "planner"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("prefer_everything");
    }

    @Test
    void getPlan_returnsStoredReport() {
        PlanProposal generated = generationService.generatePlan(request("fairness_first"), "planner");

        PlanProposal loaded = generationService.getPlan(generated.id());

        assertThat(loaded.strategy()).isEqualTo(PlanningStrategy.FAIRNESS_FIRST);
        assertThat(loaded.assignments()).hasSameSizeAs(generated.assignments());
        assertThat(loaded.coverage().coveragePercentage()).isEqualTo(generated.coverage().coveragePercentage());
        assertThat(loaded.violationSummary().total()).isZero();
    }

    @Test
    void deletePlan_removesDraftAndAssignments() {
        PlanProposal generated = generationService.generatePlan(request(null), "planner");

        generationService.deletePlan(generated.id());

        assertThat(planRepository.findById(generated.id())).isEmpty();
        assertThat(assignmentRepository.findByPlanIdOrderByIdAsc(generated.id())).isEmpty();
        assertThatThrownBy(() -> generationService.getPlan(generated.id())).isInstanceOf(NotFoundException.class);
    }

    @Test
    void deletePlan_ofCommittedPlan_throwsConflict() {
        PlanProposal generated = generationService.generatePlan(request(null), "planner");
        commitService.commitPlan(generated.id(), null, "lead");

        assertThatThrownBy(() -> generationService.deletePlan(generated.id())).isInstanceOf(ConflictException.class);
    }

    private static PlanGenerationRequest request(String strategy) {
        return new PlanGenerationRequest(new PlanGenerationRequest.DateRange(MONDAY, MONDAY), null, null, strategy, null);
    }
}
