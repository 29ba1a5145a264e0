package com.example.shiftplanner.sync;

import com.example.shiftplanner.assignment.Assignment;
import com.example.shiftplanner.assignment.AssignmentDto;
import com.example.shiftplanner.assignment.AssignmentSlot;
import com.example.shiftplanner.assignment.AssignmentStore;
import com.example.shiftplanner.constraint.ConstraintEvaluator;
import com.example.shiftplanner.constraint.ConstraintViolation;
import com.example.shiftplanner.constraint.EvaluationContext;
import com.example.shiftplanner.employee.*;
import com.example.shiftplanner.shift.ShiftDemand;
import com.example.shiftplanner.shift.ShiftDemandRepository;
import com.example.shiftplanner.shift.ShiftTemplateRepository;
import com.example.shiftplanner.station.StationRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.*;

@Service
@Transactional(readOnly = true)
public class PlanningDataService {

    static final int CONTEXT_DAYS = 7;

    private final AssignmentStore assignmentStore;
    private final StationRepository stationRepository;
    private final ShiftTemplateRepository templateRepository;
    private final ShiftDemandRepository demandRepository;
    private final EmployeeRepository employeeRepository;
    private final EmployeeSkillRepository employeeSkillRepository;
    private final AbsenceRepository absenceRepository;
    private final WorkingHourRuleRepository ruleRepository;
    private final ConstraintEvaluator constraintEvaluator;
    private final Clock clock;

    public PlanningDataService(AssignmentStore assignmentStore,
                               StationRepository stationRepository,
                               ShiftTemplateRepository templateRepository,
                               ShiftDemandRepository demandRepository,
                               EmployeeRepository employeeRepository,
                               EmployeeSkillRepository employeeSkillRepository,
                               AbsenceRepository absenceRepository,
                               WorkingHourRuleRepository ruleRepository,
                               ConstraintEvaluator constraintEvaluator,
                               Clock clock) {
        this.assignmentStore = assignmentStore;
        this.stationRepository = stationRepository;
        this.templateRepository = templateRepository;
        this.demandRepository = demandRepository;
        this.employeeRepository = employeeRepository;
        this.employeeSkillRepository = employeeSkillRepository;
        this.absenceRepository = absenceRepository;
        this.ruleRepository = ruleRepository;
        this.constraintEvaluator = constraintEvaluator;
        this.clock = clock;
    }

    public PlanningData load(LocalDate date) {
        List<Assignment> assignments = assignmentStore.findByDateRange(date, date);
        return build(date, assignments);
    }

    /**
     * Same view as {@link #load} with the given assignments in place of the stored ones.
     */
    public PlanningData loadWith(LocalDate date, List<AssignmentDto> assignments) {
        List<Assignment> detached = assignments.stream().map(PlanningDataService::detached).toList();
        return build(date, detached);
    }

    private PlanningData build(LocalDate date, List<Assignment> assignments) {
        List<ShiftDemand> demands = demandRepository.findByDateOrderByIdAsc(date);
        List<Employee> employees = employeeRepository.findAllByOrderByIdAsc();

        Map<String, Integer> assigned = new HashMap<>();
        assignments.stream().filter(Assignment::isActive)
                .forEach(a -> assigned.merge(a.getDemandId(), 1, Integer::sum));
        List<PlanningData.DemandCoverage> coverage = demands.stream()
                .map(d -> PlanningData.DemandCoverage.of(d, assigned.getOrDefault(d.getId(), 0)))
                .toList();

        List<AssignmentSlot> around = assignmentStore
                .findSlotsByDateRange(date.minusDays(CONTEXT_DAYS), date.plusDays(CONTEXT_DAYS)).stream()
                .filter(slot -> slot.assignment().isActive())
                .filter(slot -> !slot.date().equals(date))
                .toList();
        EvaluationContext context = EvaluationContext.builder(LocalDate.now(clock))
                .employees(employees)
                .skills(employees.isEmpty()
                        ? List.of()
                        : employeeSkillRepository.findByEmployeeIds(employees.stream().map(Employee::getId).toList()))
                .demands(demands)
                .demands(around.stream().map(AssignmentSlot::demand).toList())
                .absences(absenceRepository.findApprovedOverlapping(date, date))
                .rules(ruleRepository.findByActiveTrue())
                .existing(around)
                .build();
        List<ConstraintViolation> violations = constraintEvaluator.evaluate(assignments, context);

        return new PlanningData(
                date,
                stationRepository.findByActiveTrueOrderByIdAsc().stream().map(PlanningData.StationView::from).toList(),
                templateRepository.findAllByOrderByStartTimeAsc().stream().map(PlanningData.ShiftView::from).toList(),
                employees.stream().map(PlanningData.EmployeeView::from).toList(),
                assignments.stream().map(AssignmentDto::from).toList(),
                coverage,
                violations);
    }

    private static Assignment detached(AssignmentDto dto) {
        Assignment assignment = new Assignment(dto.id(), dto.demandId(), dto.employeeId());
        assignment.setPlanId(dto.planId());
        assignment.setStatus(dto.statusOrDefault());
        assignment.setScore(dto.score());
        assignment.setExplanation(dto.explanation());
        assignment.setCreatedAt(dto.createdAt());
        assignment.setCreatedBy(dto.createdBy());
        assignment.setUpdatedAt(dto.updatedAt());
        return assignment;
    }
}
