package com.example.shiftplanner.constraint.rules;

import com.example.shiftplanner.assignment.AssignmentSlot;
import com.example.shiftplanner.constraint.ConstraintViolation;
import com.example.shiftplanner.constraint.EvaluationContext;
import com.example.shiftplanner.constraint.PlanningRule;
import com.example.shiftplanner.constraint.Severity;
import com.example.shiftplanner.employee.EmployeeSkill;
import com.example.shiftplanner.station.StationSkillRequirement;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class SkillMatchingRule implements PlanningRule {

    public static final String ID = "skill-matching";
    static final int EXPIRY_WARNING_DAYS = 30;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<ConstraintViolation> evaluate(List<AssignmentSlot> slots, EvaluationContext context) {
        List<ConstraintViolation> violations = new ArrayList<>();
        LocalDate today = context.today();
        for (AssignmentSlot slot : slots) {
            String employeeId = slot.assignment().getEmployeeId();
            if (context.employee(employeeId).isEmpty()) {
                continue;
            }
            Map<String, EmployeeSkill> skills = context.skillsOf(employeeId);
            String stationName = slot.demand().getStation().getName();
            List<String> affected = List.of(slot.assignment().getId());
            for (StationSkillRequirement req : slot.demand().getStation().getRequiredSkills()) {
                String skillId = req.getSkill().getId();
                String skillName = req.getSkill().getName();
                boolean mandatory = Boolean.TRUE.equals(req.getMandatory());
                EmployeeSkill held = skills.get(skillId);
                if (held == null) {
                    if (mandatory) {
                        violations.add(new ConstraintViolation(ID, Severity.CRITICAL,
                                "Employee %s lacks mandatory skill %s for %s".formatted(employeeId, skillName, stationName),
                                affected,
                                List.of("Reassign to available employee with " + skillName, "Schedule training for " + skillName)));
                    }
                    continue;
                }
                if (held.getLevel() < req.getMinLevel()) {
                    violations.add(new ConstraintViolation(ID, mandatory ? Severity.CRITICAL : Severity.ERROR,
                            "Employee %s has %s level %d, station %s requires %d"
                                    .formatted(employeeId, skillName, held.getLevel(), stationName, req.getMinLevel()),
                            affected,
                            List.of("Reassign to employee with higher " + skillName + " level", "Provide supervised training")));
                }
                LocalDate validUntil = held.getValidUntil();
                if (validUntil == null) {
                    continue;
                }
                if (validUntil.isBefore(today)) {
                    violations.add(new ConstraintViolation(ID, Severity.CRITICAL,
                            "Certification %s of employee %s expired on %s".formatted(skillName, employeeId, validUntil),
                            affected,
                            List.of("Reassign to certified employee", "Renew certification")));
                } else if (!validUntil.isAfter(today.plusDays(EXPIRY_WARNING_DAYS))) {
                    violations.add(new ConstraintViolation(ID, Severity.WARNING,
                            "Certification %s of employee %s expires on %s".formatted(skillName, employeeId, validUntil),
                            affected,
                            List.of("Schedule recertification")));
                }
            }
        }
        return violations;
    }
}
