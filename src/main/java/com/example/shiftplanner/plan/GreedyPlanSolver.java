package com.example.shiftplanner.plan;

import com.example.shiftplanner.assignment.Assignment;
import com.example.shiftplanner.assignment.AssignmentSlot;
import com.example.shiftplanner.assignment.AssignmentStatus;
import com.example.shiftplanner.constraint.EvaluationContext;
import com.example.shiftplanner.constraint.LaborLimits;
import com.example.shiftplanner.constraint.rules.WeekendWorkRule;
import com.example.shiftplanner.employee.Employee;
import com.example.shiftplanner.employee.EmployeeSkill;
import com.example.shiftplanner.shift.ShiftDemand;
import com.example.shiftplanner.shift.ShiftType;
import com.example.shiftplanner.shift.ShiftWindow;
import com.example.shiftplanner.station.StationSkillRequirement;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.*;

/**
 * Greedy slot filling. Slots are visited by priority, then date, then size; each open
 * position goes to the best scoring employee that passes every hard filter. Ties are
 * broken by employee id so identical input always yields the identical plan.
 */
public class GreedyPlanSolver {

    static final int DEFAULT_LEVEL_SCALE = 5;

    public static final Comparator<ShiftDemand> SLOT_ORDER = Comparator
            .comparingInt((ShiftDemand d) -> d.effectivePriority().getWeight()).reversed()
            .thenComparing(ShiftDemand::getDate)
            .thenComparing(ShiftDemand::getRequiredCount, Comparator.reverseOrder())
            .thenComparing(ShiftDemand::getId);

    public SolverResult solve(PlanningProblem problem, ScoreWeights weights, String planId, String userId, Instant now) {
        EvaluationContext context = problem.toContext();
        Ledger ledger = new Ledger(problem.existing());
        List<Employee> employees = problem.employees().stream()
                .sorted(Comparator.comparing(Employee::getId))
                .toList();

        List<ShiftDemand> slots = new ArrayList<>(problem.openDemands());
        slots.sort(SLOT_ORDER);

        List<Assignment> created = new ArrayList<>();
        Map<String, Integer> newlyFilled = new HashMap<>();
        int sequence = 0;
        for (ShiftDemand demand : slots) {
            int open = problem.openPositions(demand);
            for (int position = 0; position < open; position++) {
                Optional<Candidate> best = employees.stream()
                        .filter(e -> isEligible(e, demand, context, ledger))
                        .map(e -> score(e, demand, context, ledger, weights, problem))
                        .min(Comparator.comparingDouble(Candidate::score).reversed()
                                .thenComparing(c -> c.employee().getId()));
                if (best.isEmpty()) {
                    break;
                }
                Candidate pick = best.get();
                Assignment assignment = new Assignment(planId + "-a" + (++sequence), demand.getId(), pick.employee().getId());
                assignment.setPlanId(planId);
                assignment.setStatus(AssignmentStatus.PROPOSED);
                assignment.setScore(pick.score());
                assignment.setExplanation(pick.explanation());
                assignment.setCreatedAt(now);
                assignment.setCreatedBy(userId);
                assignment.setUpdatedAt(now);
                created.add(assignment);
                ledger.book(assignment.getId(), pick.employee().getId(), demand);
                newlyFilled.merge(demand.getId(), 1, Integer::sum);
            }
        }
        return new SolverResult(created, newlyFilled);
    }

    boolean isEligible(Employee employee, ShiftDemand demand, EvaluationContext context, Ledger ledger) {
        if (!employee.isActive()) {
            return false;
        }
        LocalDate date = demand.getDate();
        if (context.absenceOn(employee.getId(), date).isPresent()) {
            return false;
        }
        if (!hasMandatorySkills(employee, demand, context)) {
            return false;
        }
        List<Booking> bookings = ledger.of(employee.getId());
        ShiftWindow window = demand.window();
        for (Booking b : bookings) {
            if (b.demandId().equals(demand.getId())) {
                return false;
            }
            if (b.date().equals(date) && b.window().overlaps(window)) {
                return false;
            }
        }

        LaborLimits limits = context.limitsFor(employee);
        double hours = window.durationHours();
        double dayHours = bookings.stream().filter(b -> b.date().equals(date))
                .mapToDouble(b -> b.window().durationHours()).sum();
        if (dayHours + hours > limits.maxHoursPerDay()) {
            return false;
        }
        LocalDate week = weekOf(date);
        double weekHours = bookings.stream().filter(b -> weekOf(b.date()).equals(week))
                .mapToDouble(b -> b.window().durationHours()).sum();
        if (weekHours + hours > limits.maxHoursPerWeek()) {
            return false;
        }
        if (!hasMinimumRest(bookings, date, window, limits.minRestHours())) {
            return false;
        }
        Set<LocalDate> workDays = new HashSet<>();
        bookings.forEach(b -> workDays.add(b.date()));
        if (runLengthWith(workDays, date) > limits.maxConsecutiveDays()) {
            return false;
        }
        if (WeekendWorkRule.isWeekend(date) && !limits.weekendWorkAllowed()) {
            return false;
        }
        if (demand.getShiftTemplate().getShiftType() == ShiftType.NIGHT) {
            Set<LocalDate> nights = new HashSet<>();
            bookings.stream().filter(Booking::night).forEach(b -> nights.add(b.date()));
            if (runLengthWith(nights, date) > limits.maxConsecutiveNights()) {
                return false;
            }
            long nightsThisWeek = nights.stream().filter(d -> weekOf(d).equals(week)).count();
            if (nightsThisWeek + 1 > limits.maxNightsPerWeek()) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasMandatorySkills(Employee employee, ShiftDemand demand, EvaluationContext context) {
        Map<String, EmployeeSkill> held = context.skillsOf(employee.getId());
        for (StationSkillRequirement req : demand.getStation().getRequiredSkills()) {
            if (!Boolean.TRUE.equals(req.getMandatory())) {
                continue;
            }
            EmployeeSkill skill = held.get(req.getSkill().getId());
            if (skill == null || skill.getLevel() < req.getMinLevel()) {
                return false;
            }
            if (skill.getValidUntil() != null && skill.getValidUntil().isBefore(context.today())) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasMinimumRest(List<Booking> bookings, LocalDate date, ShiftWindow window, int minRestHours) {
        LocalDateTime start = window.startOn(date);
        LocalDateTime end = window.endOn(date);
        Duration rest = Duration.ofHours(minRestHours);
        for (Booking b : bookings) {
            LocalDateTime bStart = b.window().startOn(b.date());
            LocalDateTime bEnd = b.window().endOn(b.date());
            boolean after = !start.isBefore(bEnd.plus(rest));
            boolean before = !end.plus(rest).isAfter(bStart);
            if (!after && !before) {
                return false;
            }
        }
        return true;
    }

    private static int runLengthWith(Set<LocalDate> dates, LocalDate date) {
        int run = 1;
        for (LocalDate d = date.minusDays(1); dates.contains(d); d = d.minusDays(1)) {
            run++;
        }
        for (LocalDate d = date.plusDays(1); dates.contains(d); d = d.plusDays(1)) {
            run++;
        }
        return run;
    }

    private static LocalDate weekOf(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    Candidate score(Employee employee, ShiftDemand demand, EvaluationContext context, Ledger ledger,
                    ScoreWeights weights, PlanningProblem problem) {
        List<Booking> bookings = ledger.of(employee.getId());

        double skill = skillMatch(employee, demand, context);

        LaborLimits limits = context.limitsFor(employee);
        LocalDate week = weekOf(demand.getDate());
        double weekHours = bookings.stream().filter(b -> weekOf(b.date()).equals(week))
                .mapToDouble(b -> b.window().durationHours()).sum();
        double availability = limits.maxHoursPerWeek() <= 0
                ? 0.0
                : clamp(1.0 - 0.5 * (weekHours / limits.maxHoursPerWeek()));

        long inRange = bookings.stream()
                .filter(b -> !b.date().isBefore(problem.start()) && !b.date().isAfter(problem.end()))
                .count();
        double fairness = 1.0 / (1.0 + inRange);

        ShiftType type = demand.getShiftTemplate().getShiftType();
        double preference = employee.getPreferredShiftType() == null
                ? 0.5
                : employee.getPreferredShiftType() == type ? 1.0 : 0.0;

        LocalDate previous = demand.getDate().minusDays(1);
        double continuity = 0.0;
        for (Booking b : bookings) {
            if (b.date().equals(previous)) {
                continuity = Math.max(continuity, b.stationId().equals(demand.getStation().getId()) ? 1.0 : 0.5);
            }
        }

        double total = weights.total();
        double raw = total <= 0 ? 0.0 : (weights.skill() * skill
                + weights.availability() * availability
                + weights.fairness() * fairness
                + weights.preference() * preference
                + weights.continuity() * continuity) / total;
        double score = Math.round(raw * 10000.0) / 10000.0;
        String explanation = "skill %.2f, availability %.2f, fairness %.2f, preference %.2f, continuity %.2f"
                .formatted(skill, availability, fairness, preference, continuity);
        return new Candidate(employee, score, explanation);
    }

    private static double skillMatch(Employee employee, ShiftDemand demand, EvaluationContext context) {
        List<StationSkillRequirement> requirements = demand.getStation().getRequiredSkills();
        if (requirements.isEmpty()) {
            return 1.0;
        }
        Map<String, EmployeeSkill> held = context.skillsOf(employee.getId());
        double sum = 0.0;
        for (StationSkillRequirement req : requirements) {
            EmployeeSkill skill = held.get(req.getSkill().getId());
            if (skill == null) {
                continue;
            }
            Integer scale = req.getSkill().getLevelScale();
            int max = scale == null || scale <= 0 ? DEFAULT_LEVEL_SCALE : scale;
            sum += Math.min(1.0, skill.getLevel() / (double) max);
        }
        return sum / requirements.size();
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    record Candidate(Employee employee, double score, String explanation) {}

    record Booking(String assignmentId, String demandId, LocalDate date, ShiftWindow window, boolean night, String stationId) {}

    public record SolverResult(List<Assignment> assignments, Map<String, Integer> newlyFilled) {}

    /**
     * Work already held by each employee, stored or picked earlier in this run.
     */
    static final class Ledger {
        private final Map<String, List<Booking>> byEmployee = new HashMap<>();

        Ledger(List<AssignmentSlot> existing) {
            for (AssignmentSlot slot : existing) {
                add(slot.assignment().getId(), slot.assignment().getEmployeeId(), slot.demand());
            }
        }

        void book(String assignmentId, String employeeId, ShiftDemand demand) {
            add(assignmentId, employeeId, demand);
        }

        List<Booking> of(String employeeId) {
            return byEmployee.getOrDefault(employeeId, List.of());
        }

        private void add(String assignmentId, String employeeId, ShiftDemand demand) {
            byEmployee.computeIfAbsent(employeeId, k -> new ArrayList<>()).add(new Booking(
                    assignmentId,
                    demand.getId(),
                    demand.getDate(),
                    demand.window(),
                    demand.getShiftTemplate().getShiftType() == ShiftType.NIGHT,
                    demand.getStation().getId()));
        }
    }
}
