package com.example.shiftplanner.plan;

import com.example.shiftplanner.assignment.AssignmentSlot;
import com.example.shiftplanner.assignment.AssignmentStore;
import com.example.shiftplanner.employee.*;
import com.example.shiftplanner.exception.ValidationException;
import com.example.shiftplanner.shift.ShiftDemand;
import com.example.shiftplanner.shift.ShiftDemandRepository;
import com.example.shiftplanner.shift.ShiftTemplateRepository;
import com.example.shiftplanner.station.StationRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.*;

@Component
public class PlanningProblemLoader {

    // look-around so weekly hours, rest and consecutive days see stored work at the range edges
    static final int CONTEXT_DAYS = 7;

    private final ShiftDemandRepository demandRepository;
    private final StationRepository stationRepository;
    private final ShiftTemplateRepository templateRepository;
    private final EmployeeRepository employeeRepository;
    private final EmployeeSkillRepository employeeSkillRepository;
    private final AbsenceRepository absenceRepository;
    private final WorkingHourRuleRepository ruleRepository;
    private final AssignmentStore assignmentStore;

    public PlanningProblemLoader(ShiftDemandRepository demandRepository,
                                 StationRepository stationRepository,
                                 ShiftTemplateRepository templateRepository,
                                 EmployeeRepository employeeRepository,
                                 EmployeeSkillRepository employeeSkillRepository,
                                 AbsenceRepository absenceRepository,
                                 WorkingHourRuleRepository ruleRepository,
                                 AssignmentStore assignmentStore) {
        this.demandRepository = demandRepository;
        this.stationRepository = stationRepository;
        this.templateRepository = templateRepository;
        this.employeeRepository = employeeRepository;
        this.employeeSkillRepository = employeeSkillRepository;
        this.absenceRepository = absenceRepository;
        this.ruleRepository = ruleRepository;
        this.assignmentStore = assignmentStore;
    }

    @Transactional(readOnly = true)
    public PlanningProblem load(LocalDate start, LocalDate end,
                                Collection<String> stationIds,
                                Collection<String> shiftTemplateIds,
                                LocalDate today) {
        Set<String> stations = normalize(stationIds);
        Set<String> templates = normalize(shiftTemplateIds);
        requireKnown(stations, stationRepository.findAllById(stations).size(), "station");
        requireKnown(templates, templateRepository.findAllById(templates).size(), "shift template");

        List<ShiftDemand> demands = demandRepository.findByDateBetweenOrderByDateAscIdAsc(start, end).stream()
                .filter(d -> !Boolean.FALSE.equals(d.getStation().getActive()))
                .filter(d -> stations.isEmpty() || stations.contains(d.getStation().getId()))
                .filter(d -> templates.isEmpty() || templates.contains(d.getShiftTemplate().getId()))
                .toList();

        List<AssignmentSlot> existing = assignmentStore
                .findSlotsByDateRange(start.minusDays(CONTEXT_DAYS), end.plusDays(CONTEXT_DAYS)).stream()
                .filter(slot -> slot.assignment().isActive())
                .toList();
        Map<String, Integer> filled = new HashMap<>();
        existing.forEach(slot -> filled.merge(slot.assignment().getDemandId(), 1, Integer::sum));

        List<Employee> employees = employeeRepository.findAllByOrderByIdAsc();
        List<EmployeeSkill> skills = employees.isEmpty()
                ? List.of()
                : employeeSkillRepository.findByEmployeeIds(employees.stream().map(Employee::getId).toList());
        List<Absence> absences = absenceRepository.findApprovedOverlapping(
                start.minusDays(CONTEXT_DAYS), end.plusDays(CONTEXT_DAYS));

        return new PlanningProblem(start, end, demands, filled, employees, skills, absences,
                ruleRepository.findByActiveTrue(), existing, today);
    }

    private static Set<String> normalize(Collection<String> ids) {
        if (ids == null) {
            return Set.of();
        }
        Set<String> result = new LinkedHashSet<>();
        ids.stream().filter(Objects::nonNull).map(String::trim).filter(s -> !s.isEmpty()).forEach(result::add);
        return result;
    }

    private static void requireKnown(Set<String> requested, int found, String kind) {
        if (found < requested.size()) {
            throw new ValidationException("Unknown " + kind + " id in " + requested, requested);
        }
    }
}
