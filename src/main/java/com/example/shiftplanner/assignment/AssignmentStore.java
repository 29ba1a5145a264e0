package com.example.shiftplanner.assignment;

import com.example.shiftplanner.employee.Employee;
import com.example.shiftplanner.employee.EmployeeRepository;
import com.example.shiftplanner.shift.ShiftDemand;
import com.example.shiftplanner.shift.ShiftDemandRepository;
import com.example.shiftplanner.shift.ShiftWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Durable record of assignments. Every double-booking question on the server is
 * answered here, against the shift template behind each assignment's demand.
 */
@Service
@Transactional
public class AssignmentStore {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentStore.class);

    private final AssignmentRepository assignmentRepository;
    private final ShiftDemandRepository demandRepository;
    private final EmployeeRepository employeeRepository;

    public AssignmentStore(AssignmentRepository assignmentRepository,
                           ShiftDemandRepository demandRepository,
                           EmployeeRepository employeeRepository) {
        this.assignmentRepository = assignmentRepository;
        this.demandRepository = demandRepository;
        this.employeeRepository = employeeRepository;
    }

    @Transactional(readOnly = true)
    public Optional<Assignment> findById(String id) {
        return assignmentRepository.findById(id);
    }

    @Transactional(readOnly = true)
    public Optional<ShiftDemand> findDemand(String demandId) {
        if (demandId == null) {
            return Optional.empty();
        }
        return demandRepository.findById(demandId);
    }

    /**
     * Proposed or confirmed assignments of the employee on that date whose window
     * overlaps {@code [shiftStart, shiftEnd)}.
     */
    @Transactional(readOnly = true)
    public List<Assignment> findConflicting(String employeeId, LocalDate date, LocalTime shiftStart, LocalTime shiftEnd) {
        return findConflicting(employeeId, date, ShiftWindow.of(shiftStart, shiftEnd), null);
    }

    @Transactional(readOnly = true)
    public List<Assignment> findConflicting(String employeeId, LocalDate date, ShiftWindow window, String excludeId) {
        List<AssignmentSlot> slots = AssignmentSlot.fromRows(
                assignmentRepository.findSlotsForEmployeeOnDate(employeeId, date, AssignmentStatus.ACTIVE));
        return slots.stream()
                .filter(slot -> excludeId == null || !excludeId.equals(slot.assignment().getId()))
                .filter(slot -> slot.window().overlaps(window))
                .map(AssignmentSlot::assignment)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Assignment> findByDateRange(LocalDate start, LocalDate end) {
        return findSlotsByDateRange(start, end).stream().map(AssignmentSlot::assignment).toList();
    }

    @Transactional(readOnly = true)
    public List<AssignmentSlot> findSlotsByDateRange(LocalDate start, LocalDate end) {
        return AssignmentSlot.fromRows(assignmentRepository.findSlotsByDateRange(start, end));
    }

    @Transactional(readOnly = true)
    public List<AssignmentSlot> findByEmployee(String employeeId, LocalDate start, LocalDate end) {
        return AssignmentSlot.fromRows(assignmentRepository.findSlotsForEmployee(employeeId, start, end));
    }

    @Transactional(readOnly = true)
    public List<Assignment> findByPlan(String planId) {
        return assignmentRepository.findByPlanIdOrderByIdAsc(planId);
    }

    public Assignment create(AssignmentDto dto, String userId, Instant now) {
        Assignment assignment = new Assignment(dto.id(), dto.demandId(), dto.employeeId());
        assignment.setPlanId(dto.planId());
        assignment.setStatus(dto.statusOrDefault());
        assignment.setScore(dto.score() == null ? 0.0 : dto.score());
        assignment.setExplanation(dto.explanation());
        assignment.setCreatedAt(dto.createdAt() == null ? now : dto.createdAt());
        assignment.setCreatedBy(userId);
        assignment.setUpdatedAt(now);
        return assignmentRepository.save(assignment);
    }

    public Assignment update(Assignment existing, AssignmentDto dto, Instant now) {
        existing.setDemandId(dto.demandId());
        existing.setEmployeeId(dto.employeeId());
        if (dto.status() != null) {
            existing.setStatus(dto.status());
        }
        if (dto.score() != null) {
            existing.setScore(dto.score());
        }
        existing.setExplanation(dto.explanation());
        existing.setUpdatedAt(now);
        return assignmentRepository.save(existing);
    }

    public Assignment upsert(AssignmentDto dto, String userId, Instant now) {
        return assignmentRepository.findById(dto.id())
                .map(existing -> update(existing, dto, now))
                .orElseGet(() -> create(dto, userId, now));
    }

    public Assignment save(Assignment assignment) {
        return assignmentRepository.save(assignment);
    }

    /**
     * @return false when the assignment was already gone
     */
    public boolean delete(String id) {
        Optional<Assignment> existing = assignmentRepository.findById(id);
        if (existing.isEmpty()) {
            return false;
        }
        assignmentRepository.delete(existing.get());
        logger.debug("Deleted assignment {}", id);
        return true;
    }

    @Transactional(readOnly = true)
    public AssignmentStats getAssignmentStats(LocalDate start, LocalDate end) {
        List<AssignmentSlot> slots = findSlotsByDateRange(start, end);

        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (AssignmentStatus status : AssignmentStatus.values()) {
            byStatus.put(status.getCode(), 0L);
        }
        double scoreSum = 0.0;
        int scored = 0;
        Map<String, long[]> counts = new TreeMap<>();
        Map<String, Integer> minutes = new HashMap<>();
        for (AssignmentSlot slot : slots) {
            Assignment a = slot.assignment();
            byStatus.merge(a.getStatus().getCode(), 1L, Long::sum);
            if (a.getScore() != null) {
                scoreSum += a.getScore();
                scored++;
            }
            if (!a.isActive()) {
                continue;
            }
            counts.computeIfAbsent(a.getEmployeeId(), k -> new long[1])[0]++;
            minutes.merge(a.getEmployeeId(), slot.window().durationMinutes(), Integer::sum);
        }

        Map<String, String> names = employeeRepository.findAllById(counts.keySet()).stream()
                .collect(Collectors.toMap(Employee::getId, Employee::getName));
        List<AssignmentStats.EmployeeWorkload> byEmployee = new ArrayList<>();
        int totalMinutes = 0;
        for (Map.Entry<String, long[]> e : counts.entrySet()) {
            int m = minutes.getOrDefault(e.getKey(), 0);
            totalMinutes += m;
            byEmployee.add(new AssignmentStats.EmployeeWorkload(
                    e.getKey(), names.get(e.getKey()), e.getValue()[0], round2(m / 60.0)));
        }

        double average = scored == 0 ? 0.0 : round2(scoreSum / scored);
        return new AssignmentStats(start, end, slots.size(), byStatus, byEmployee,
                round2(totalMinutes / 60.0), average);
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
