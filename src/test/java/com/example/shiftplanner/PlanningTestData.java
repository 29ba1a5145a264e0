package com.example.shiftplanner;

import com.example.shiftplanner.assignment.Assignment;
import com.example.shiftplanner.assignment.AssignmentRepository;
import com.example.shiftplanner.assignment.AssignmentStatus;
import com.example.shiftplanner.employee.*;
import com.example.shiftplanner.plan.PlanRepository;
import com.example.shiftplanner.shift.ShiftDemand;
import com.example.shiftplanner.shift.ShiftDemandRepository;
import com.example.shiftplanner.shift.ShiftTemplate;
import com.example.shiftplanner.shift.ShiftTemplateRepository;
import com.example.shiftplanner.skill.Skill;
import com.example.shiftplanner.skill.SkillRepository;
import com.example.shiftplanner.station.Station;
import com.example.shiftplanner.station.StationRepository;
import com.example.shiftplanner.sync.PlanningSnapshotRepository;
import org.springframework.boot.test.context.TestComponent;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Saves and clears reference data for database-backed tests.
 */
@TestComponent
public class PlanningTestData {

    private final AssignmentRepository assignmentRepository;
    private final PlanRepository planRepository;
    private final PlanningSnapshotRepository snapshotRepository;
    private final ShiftDemandRepository demandRepository;
    private final StationRepository stationRepository;
    private final ShiftTemplateRepository templateRepository;
    private final EmployeeSkillRepository employeeSkillRepository;
    private final AbsenceRepository absenceRepository;
    private final EmployeeRepository employeeRepository;
    private final SkillRepository skillRepository;
    private final WorkingHourRuleRepository ruleRepository;

    public PlanningTestData(AssignmentRepository assignmentRepository,
                            PlanRepository planRepository,
                            PlanningSnapshotRepository snapshotRepository,
                            ShiftDemandRepository demandRepository,
                            StationRepository stationRepository,
                            ShiftTemplateRepository templateRepository,
                            EmployeeSkillRepository employeeSkillRepository,
                            AbsenceRepository absenceRepository,
                            EmployeeRepository employeeRepository,
                            SkillRepository skillRepository,
                            WorkingHourRuleRepository ruleRepository) {
        this.assignmentRepository = assignmentRepository;
        this.planRepository = planRepository;
        this.snapshotRepository = snapshotRepository;
        this.demandRepository = demandRepository;
        this.stationRepository = stationRepository;
        this.templateRepository = templateRepository;
        this.employeeSkillRepository = employeeSkillRepository;
        this.absenceRepository = absenceRepository;
        this.employeeRepository = employeeRepository;
        this.skillRepository = skillRepository;
        this.ruleRepository = ruleRepository;
    }

    public void clear() {
        assignmentRepository.deleteAll();
        planRepository.deleteAll();
        snapshotRepository.deleteAll();
        demandRepository.deleteAll();
        stationRepository.deleteAll();
        templateRepository.deleteAll();
        employeeSkillRepository.deleteAll();
        absenceRepository.deleteAll();
        employeeRepository.deleteAll();
        skillRepository.deleteAll();
        ruleRepository.deleteAll();
    }

    public Skill skill(Skill skill) {
        return skillRepository.save(skill);
    }

    public Station station(Station station) {
        return stationRepository.save(station);
    }

    public ShiftTemplate template(ShiftTemplate template) {
        return templateRepository.save(template);
    }

    public ShiftDemand demand(String id, LocalDate date, Station station, ShiftTemplate template, int required) {
        return demandRepository.save(new ShiftDemand(id, date, station, template, required));
    }

    public Employee employee(String id) {
        return employeeRepository.save(new Employee(id, "Employee " + id, ContractType.FULL_TIME));
    }

    public EmployeeSkill employeeSkill(Employee employee, Skill skill, int level) {
        return employeeSkillRepository.save(new EmployeeSkill(employee, skill, level, null));
    }

    public Absence absence(Absence absence) {
        return absenceRepository.save(absence);
    }

    public Assignment assignment(String id, String demandId, String employeeId, AssignmentStatus status, Instant updatedAt) {
        Assignment assignment = new Assignment(id, demandId, employeeId);
        assignment.setStatus(status);
        assignment.setScore(0.5);
        assignment.setCreatedAt(updatedAt);
        assignment.setCreatedBy("seed");
        assignment.setUpdatedAt(updatedAt);
        return assignmentRepository.save(assignment);
    }
}
