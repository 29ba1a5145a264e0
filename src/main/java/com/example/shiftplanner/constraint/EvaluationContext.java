package com.example.shiftplanner.constraint;

import com.example.shiftplanner.assignment.AssignmentSlot;
import com.example.shiftplanner.employee.Absence;
import com.example.shiftplanner.employee.ContractType;
import com.example.shiftplanner.employee.Employee;
import com.example.shiftplanner.employee.EmployeeSkill;
import com.example.shiftplanner.employee.WorkingHourRule;
import com.example.shiftplanner.shift.ShiftDemand;

import java.time.LocalDate;
import java.util.*;

/**
 * Everything the rules may look at besides the assignments under evaluation.
 * {@code today} is supplied by the caller; rules never read the clock.
 */
public final class EvaluationContext {

    private final Map<String, Employee> employees;
    private final Map<String, Map<String, EmployeeSkill>> skillsByEmployee;
    private final Map<String, ShiftDemand> demands;
    private final Map<String, List<Absence>> absencesByEmployee;
    private final Map<ContractType, WorkingHourRule> rules;
    private final List<AssignmentSlot> existing;
    private final LocalDate today;

    private EvaluationContext(Builder builder) {
        this.employees = Map.copyOf(builder.employees);
        Map<String, Map<String, EmployeeSkill>> skills = new HashMap<>();
        for (EmployeeSkill es : builder.skills) {
            skills.computeIfAbsent(es.getEmployee().getId(), k -> new HashMap<>())
                    .put(es.getSkill().getId(), es);
        }
        this.skillsByEmployee = skills;
        this.demands = Map.copyOf(builder.demands);
        Map<String, List<Absence>> absences = new HashMap<>();
        for (Absence absence : builder.absences) {
            if (Boolean.TRUE.equals(absence.getApproved())) {
                absences.computeIfAbsent(absence.getEmployeeId(), k -> new ArrayList<>()).add(absence);
            }
        }
        this.absencesByEmployee = absences;
        Map<ContractType, WorkingHourRule> byContract = new EnumMap<>(ContractType.class);
        for (WorkingHourRule rule : builder.rules) {
            if (!Boolean.FALSE.equals(rule.getActive())) {
                byContract.putIfAbsent(rule.getContractType(), rule);
            }
        }
        this.rules = byContract;
        this.existing = List.copyOf(builder.existing);
        this.today = Objects.requireNonNull(builder.today, "today");
    }

    public static Builder builder(LocalDate today) {
        return new Builder(today);
    }

    public Optional<Employee> employee(String employeeId) {
        return Optional.ofNullable(employees.get(employeeId));
    }

    public Collection<Employee> employees() {
        return employees.values();
    }

    public Map<String, EmployeeSkill> skillsOf(String employeeId) {
        return skillsByEmployee.getOrDefault(employeeId, Map.of());
    }

    public Optional<ShiftDemand> demand(String demandId) {
        return Optional.ofNullable(demands.get(demandId));
    }

    public Optional<Absence> absenceOn(String employeeId, LocalDate date) {
        return absencesByEmployee.getOrDefault(employeeId, List.of()).stream()
                .filter(a -> a.covers(date))
                .findFirst();
    }

    public LaborLimits limitsFor(Employee employee) {
        return LaborLimits.resolve(employee, rules.get(employee.getContractType()));
    }

    /** Active assignments stored outside the set under evaluation. */
    public List<AssignmentSlot> existing() {
        return existing;
    }

    public LocalDate today() {
        return today;
    }

    public static final class Builder {
        private final LocalDate today;
        private final Map<String, Employee> employees = new HashMap<>();
        private final List<EmployeeSkill> skills = new ArrayList<>();
        private final Map<String, ShiftDemand> demands = new HashMap<>();
        private final List<Absence> absences = new ArrayList<>();
        private final List<WorkingHourRule> rules = new ArrayList<>();
        private final List<AssignmentSlot> existing = new ArrayList<>();

        private Builder(LocalDate today) {
            this.today = today;
        }

        public Builder employees(Collection<Employee> values) {
            values.forEach(e -> employees.put(e.getId(), e));
            return this;
        }

        public Builder skills(Collection<EmployeeSkill> values) {
            skills.addAll(values);
            return this;
        }

        public Builder demands(Collection<ShiftDemand> values) {
            values.forEach(d -> demands.put(d.getId(), d));
            return this;
        }

        public Builder absences(Collection<Absence> values) {
            absences.addAll(values);
            return this;
        }

        public Builder rules(Collection<WorkingHourRule> values) {
            rules.addAll(values);
            return this;
        }

        public Builder existing(Collection<AssignmentSlot> values) {
            existing.addAll(values);
            return this;
        }

        public EvaluationContext build() {
            return new EvaluationContext(this);
        }
    }
}
