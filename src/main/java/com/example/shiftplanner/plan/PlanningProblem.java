package com.example.shiftplanner.plan;

import com.example.shiftplanner.assignment.AssignmentSlot;
import com.example.shiftplanner.constraint.EvaluationContext;
import com.example.shiftplanner.employee.Absence;
import com.example.shiftplanner.employee.Employee;
import com.example.shiftplanner.employee.EmployeeSkill;
import com.example.shiftplanner.employee.WorkingHourRule;
import com.example.shiftplanner.shift.ShiftDemand;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Input to a single generation run, fully loaded so the solver touches no repository.
 *
 * @param demands      in-scope demand slots, open or not
 * @param alreadyFilled active stored assignments per demand id
 * @param existing     active stored assignments around the range, for hour and rest checks
 */
public record PlanningProblem(
        LocalDate start,
        LocalDate end,
        List<ShiftDemand> demands,
        Map<String, Integer> alreadyFilled,
        List<Employee> employees,
        List<EmployeeSkill> skills,
        List<Absence> absences,
        List<WorkingHourRule> rules,
        List<AssignmentSlot> existing,
        LocalDate today
) {
    public int openPositions(ShiftDemand demand) {
        return Math.max(0, demand.getRequiredCount() - alreadyFilled.getOrDefault(demand.getId(), 0));
    }

    public List<ShiftDemand> openDemands() {
        return demands.stream().filter(d -> openPositions(d) > 0).toList();
    }

    public boolean hasActiveEmployees() {
        return employees.stream().anyMatch(Employee::isActive);
    }

    public EvaluationContext toContext() {
        return EvaluationContext.builder(today)
                .employees(employees)
                .skills(skills)
                .demands(demands)
                .demands(existing.stream().map(AssignmentSlot::demand).toList())
                .absences(absences)
                .rules(rules)
                .existing(existing)
                .build();
    }
}
