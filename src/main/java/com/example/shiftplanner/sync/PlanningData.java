package com.example.shiftplanner.sync;

import com.example.shiftplanner.assignment.AssignmentDto;
import com.example.shiftplanner.constraint.ConstraintViolation;
import com.example.shiftplanner.employee.ContractType;
import com.example.shiftplanner.employee.Employee;
import com.example.shiftplanner.shift.ShiftDemand;
import com.example.shiftplanner.shift.ShiftTemplate;
import com.example.shiftplanner.shift.ShiftType;
import com.example.shiftplanner.station.Priority;
import com.example.shiftplanner.station.Station;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Authoritative view of one planning day, as served to clients on load or restore.
 */
public record PlanningData(
        LocalDate date,
        List<StationView> stations,
        List<ShiftView> shifts,
        List<EmployeeView> employees,
        List<AssignmentDto> assignments,
        List<DemandCoverage> coverageStatus,
        List<ConstraintViolation> violations
) {

    public record StationView(String id, String name, String line, Priority priority, Integer capacity,
                              List<RequirementView> requiredSkills) {
        public static StationView from(Station station) {
            return new StationView(station.getId(), station.getName(), station.getLine(), station.getPriority(),
                    station.getCapacity(),
                    station.getRequiredSkills().stream()
                            .map(r -> new RequirementView(r.getSkill().getId(), r.getSkill().getName(),
                                    r.getMinLevel(), Boolean.TRUE.equals(r.getMandatory())))
                            .toList());
        }
    }

    public record RequirementView(String skillId, String skillName, int minLevel, boolean mandatory) {}

    public record ShiftView(String id, String name, LocalTime startTime, LocalTime endTime, ShiftType shiftType) {
        public static ShiftView from(ShiftTemplate template) {
            return new ShiftView(template.getId(), template.getName(), template.getStartTime(),
                    template.getEndTime(), template.getShiftType());
        }
    }

    public record EmployeeView(String id, String name, ContractType contractType, String team,
                               boolean active, Integer weeklyHours) {
        public static EmployeeView from(Employee employee) {
            return new EmployeeView(employee.getId(), employee.getName(), employee.getContractType(),
                    employee.getTeam(), employee.isActive(), employee.getWeeklyHours());
        }
    }

    public record DemandCoverage(String demandId, String stationId, String shiftTemplateId,
                                 int required, int assigned, double coveragePercentage, String status) {
        public static DemandCoverage of(ShiftDemand demand, int assigned) {
            int required = demand.getRequiredCount();
            double percentage = required == 0 ? 100.0 : Math.round(assigned * 1000.0 / required) / 10.0;
            String status = assigned < required ? "understaffed" : assigned == required ? "optimal" : "overstaffed";
            return new DemandCoverage(demand.getId(), demand.getStation().getId(),
                    demand.getShiftTemplate().getId(), required, assigned, percentage, status);
        }
    }
}
