package com.example.shiftplanner;

import com.example.shiftplanner.assignment.Assignment;
import com.example.shiftplanner.assignment.AssignmentStatus;
import com.example.shiftplanner.employee.ContractType;
import com.example.shiftplanner.employee.Employee;
import com.example.shiftplanner.shift.ShiftDemand;
import com.example.shiftplanner.shift.ShiftTemplate;
import com.example.shiftplanner.shift.ShiftType;
import com.example.shiftplanner.skill.Skill;
import com.example.shiftplanner.station.Priority;
import com.example.shiftplanner.station.Station;
import com.example.shiftplanner.station.StationSkillRequirement;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Unsaved entities for tests. Persist them through the repositories where a test needs a database.
 */
public final class PlanningFixtures {

    public static final LocalDate MONDAY = LocalDate.of(2026, 3, 2);
    public static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");

    private PlanningFixtures() {
    }

    public static Skill skill(String id) {
        return new Skill(id, id.substring(0, 1).toUpperCase() + id.substring(1), null);
    }

    public static Station station(String id, Priority priority) {
        return new Station(id, "Station " + id, "line-1", priority);
    }

    public static Station stationRequiring(String id, Skill skill, int minLevel, boolean mandatory) {
        Station station = station(id, Priority.MEDIUM);
        station.addRequirement(new StationSkillRequirement(skill, minLevel, mandatory));
        return station;
    }

    public static ShiftTemplate early() {
        return new ShiftTemplate("early", "Early", LocalTime.of(6, 0), LocalTime.of(14, 0), ShiftType.DAY);
    }

    public static ShiftTemplate midday() {
        return new ShiftTemplate("midday", "Midday", LocalTime.of(10, 0), LocalTime.of(18, 0), ShiftType.DAY);
    }

    public static ShiftTemplate late() {
        return new ShiftTemplate("late", "Late", LocalTime.of(14, 0), LocalTime.of(22, 0), ShiftType.SWING);
    }

    public static ShiftTemplate night() {
        return new ShiftTemplate("night", "Night", LocalTime.of(22, 0), LocalTime.of(6, 0), ShiftType.NIGHT);
    }

    public static ShiftDemand demand(String id, LocalDate date, Station station, ShiftTemplate template, int required) {
        return new ShiftDemand(id, date, station, template, required);
    }

    public static Employee employee(String id) {
        return new Employee(id, "Employee " + id, ContractType.FULL_TIME);
    }

    public static Assignment assignment(String id, String demandId, String employeeId, AssignmentStatus status) {
        Assignment assignment = new Assignment(id, demandId, employeeId);
        assignment.setStatus(status);
        assignment.setCreatedAt(NOW);
        assignment.setUpdatedAt(NOW);
        assignment.setCreatedBy("test");
        return assignment;
    }
}
