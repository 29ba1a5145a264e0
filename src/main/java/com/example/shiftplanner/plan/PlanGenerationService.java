package com.example.shiftplanner.plan;

import com.example.shiftplanner.assignment.Assignment;
import com.example.shiftplanner.assignment.AssignmentDto;
import com.example.shiftplanner.assignment.AssignmentRepository;
import com.example.shiftplanner.assignment.AssignmentStatus;
import com.example.shiftplanner.config.PlanningSettings;
import com.example.shiftplanner.constraint.ConstraintEvaluator;
import com.example.shiftplanner.constraint.ConstraintViolation;
import com.example.shiftplanner.constraint.ViolationReporter;
import com.example.shiftplanner.exception.BusinessException;
import com.example.shiftplanner.exception.ConflictException;
import com.example.shiftplanner.exception.InsufficientDataException;
import com.example.shiftplanner.exception.NotFoundException;
import com.example.shiftplanner.exception.ValidationException;
import com.example.shiftplanner.shift.ShiftDemand;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.*;

@Service
@Transactional
public class PlanGenerationService {

    private static final Logger logger = LoggerFactory.getLogger(PlanGenerationService.class);

    private final PlanningProblemLoader problemLoader;
    private final ConstraintEvaluator constraintEvaluator;
    private final ViolationReporter violationReporter;
    private final PlanRepository planRepository;
    private final AssignmentRepository assignmentRepository;
    private final PlanningSettings settings;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final GreedyPlanSolver solver = new GreedyPlanSolver();

    public PlanGenerationService(PlanningProblemLoader problemLoader,
                                 ConstraintEvaluator constraintEvaluator,
                                 ViolationReporter violationReporter,
                                 PlanRepository planRepository,
                                 AssignmentRepository assignmentRepository,
                                 PlanningSettings settings,
                                 ObjectMapper objectMapper,
                                 Clock clock) {
        this.problemLoader = problemLoader;
        this.constraintEvaluator = constraintEvaluator;
        this.violationReporter = violationReporter;
        this.planRepository = planRepository;
        this.assignmentRepository = assignmentRepository;
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public PlanProposal generatePlan(PlanGenerationRequest request, String userId) {
        LocalDate start = request.dateRange().start();
        LocalDate end = request.dateRange().end();
        if (end.isBefore(start)) {
            throw new ValidationException("End date must not be before start date");
        }
        long days = ChronoUnit.DAYS.between(start, end) + 1;
        if (days > settings.getMaxRangeDays()) {
            throw new ValidationException("Date range is limited to %d days".formatted(settings.getMaxRangeDays()));
        }
        PlanningStrategy strategy;
        try {
            strategy = PlanningStrategy.fromCode(request.strategy());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), request.strategy());
        }
        ScoreWeights weights = strategy.weights();
        if (request.constraints() != null) {
            for (CustomConstraint constraint : request.constraints()) {
                weights = constraint.applyTo(weights);
            }
        }

        Instant now = clock.instant();
        LocalDate today = LocalDate.now(clock);
        PlanningProblem problem = problemLoader.load(start, end, request.stationIds(), request.shiftTemplateIds(), today);
        if (!problem.hasActiveEmployees()) {
            throw new InsufficientDataException("No active employees available for planning");
        }
        if (problem.openDemands().isEmpty()) {
            throw new InsufficientDataException("No open demand between %s and %s in the requested scope".formatted(start, end));
        }

        long started = System.currentTimeMillis();
        String planId = "plan-" + UUID.randomUUID();
        GreedyPlanSolver.SolverResult result = solver.solve(problem, weights, planId, userId, now);

        Map<String, Integer> filled = new HashMap<>();
        for (ShiftDemand demand : problem.demands()) {
            int total = problem.alreadyFilled().getOrDefault(demand.getId(), 0)
                    + result.newlyFilled().getOrDefault(demand.getId(), 0);
            filled.put(demand.getId(), total);
        }
        CoverageStatus coverage = CoverageCalculator.compute(problem.demands(), filled);
        List<ConstraintViolation> violations = constraintEvaluator.evaluate(result.assignments(), problem.toContext());

        Plan plan = new Plan(planId, start, end, strategy);
        plan.setName("Plan %s to %s".formatted(start, end));
        plan.setStatus(PlanStatus.DRAFT);
        plan.setCreatedAt(now);
        plan.setCreatedBy(userId);
        plan.setExplanation("%d assignments for %d open slots using %s strategy"
                .formatted(result.assignments().size(), problem.openDemands().size(), strategy.getCode()));
        plan.setCoverageJson(write(coverage));
        plan.setViolationsJson(write(violations));
        planRepository.save(plan);
        assignmentRepository.saveAll(result.assignments());

        logger.info("Generated plan {} ({} assignments, coverage {}%, {} violations) in {}ms",
                planId, result.assignments().size(), coverage.coveragePercentage(), violations.size(),
                System.currentTimeMillis() - started);
        return toProposal(plan, result.assignments(), coverage, violations);
    }

    @Transactional(readOnly = true)
    public PlanProposal getPlan(String planId) {
        Plan plan = planRepository.findById(planId).orElseThrow(() -> NotFoundException.of("Plan", planId));
        List<Assignment> assignments = assignmentRepository.findByPlanIdOrderByIdAsc(planId);
        CoverageStatus coverage = read(plan.getCoverageJson(), new TypeReference<CoverageStatus>() {});
        List<ConstraintViolation> violations = read(plan.getViolationsJson(), new TypeReference<List<ConstraintViolation>>() {});
        return toProposal(plan, assignments, coverage, violations == null ? List.of() : violations);
    }

    /**
     * Removes a plan that has not been committed, with its non-confirmed assignments.
     */
    public void deletePlan(String planId) {
        Plan plan = planRepository.findForUpdate(planId).orElseThrow(() -> NotFoundException.of("Plan", planId));
        if (plan.getStatus() == PlanStatus.COMMITTED) {
            throw new ConflictException("Committed plans cannot be deleted", planId);
        }
        long removed = assignmentRepository.deleteByPlanIdAndStatusNot(planId, AssignmentStatus.CONFIRMED);
        planRepository.delete(plan);
        logger.info("Deleted plan {} with {} assignments", planId, removed);
    }

    private PlanProposal toProposal(Plan plan, List<Assignment> assignments, CoverageStatus coverage,
                                    List<ConstraintViolation> violations) {
        return new PlanProposal(
                plan.getId(),
                plan.getName(),
                plan.getStatus(),
                plan.getStartDate(),
                plan.getEndDate(),
                plan.getStrategy(),
                assignments.stream().map(AssignmentDto::from).toList(),
                coverage,
                violations,
                violationReporter.summarize(violations),
                plan.getExplanation(),
                plan.getCreatedAt(),
                plan.getCreatedBy());
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new BusinessException("SERIALIZATION_ERROR", HttpStatus.INTERNAL_SERVER_ERROR,
                    "Failed to serialize plan report", e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new BusinessException("SERIALIZATION_ERROR", HttpStatus.INTERNAL_SERVER_ERROR,
                    "Failed to read stored plan report", e);
        }
    }
}
