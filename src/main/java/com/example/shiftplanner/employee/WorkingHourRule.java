package com.example.shiftplanner.employee;

import jakarta.persistence.*;

/**
 * Labor limits for one contract type. Employees without an active rule fall back
 * to the limits stored on their own record.
 */
@Entity
@Table(name = "working_hour_rules")
public class WorkingHourRule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "contract_type", nullable = false, length = 20)
    private ContractType contractType;

    @Column(name = "max_consecutive_days")
    private Integer maxConsecutiveDays = 6;

    @Column(name = "max_hours_per_week")
    private Integer maxHoursPerWeek = 40;

    @Column(name = "max_hours_per_day")
    private Integer maxHoursPerDay = 10;

    @Column(name = "min_hours_between_shifts")
    private Integer minHoursBetweenShifts = 11;

    @Column(name = "weekend_work_allowed")
    private Boolean weekendWorkAllowed = true;

    @Column(name = "max_consecutive_nights")
    private Integer maxConsecutiveNights = 3;

    @Column(name = "max_nights_per_week")
    private Integer maxNightsPerWeek = 4;

    @Column(nullable = false)
    private Boolean active = true;

    protected WorkingHourRule() {
    }

    public WorkingHourRule(String name, ContractType contractType) {
        this.name = name;
        this.contractType = contractType;
    }

    public Long getId() { return id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public ContractType getContractType() { return contractType; }
    public void setContractType(ContractType contractType) { this.contractType = contractType; }
    public Integer getMaxConsecutiveDays() { return maxConsecutiveDays; }
    public void setMaxConsecutiveDays(Integer maxConsecutiveDays) { this.maxConsecutiveDays = maxConsecutiveDays; }
    public Integer getMaxHoursPerWeek() { return maxHoursPerWeek; }
    public void setMaxHoursPerWeek(Integer maxHoursPerWeek) { this.maxHoursPerWeek = maxHoursPerWeek; }
    public Integer getMaxHoursPerDay() { return maxHoursPerDay; }
    public void setMaxHoursPerDay(Integer maxHoursPerDay) { this.maxHoursPerDay = maxHoursPerDay; }
    public Integer getMinHoursBetweenShifts() { return minHoursBetweenShifts; }
    public void setMinHoursBetweenShifts(Integer minHoursBetweenShifts) { this.minHoursBetweenShifts = minHoursBetweenShifts; }
    public Boolean getWeekendWorkAllowed() { return weekendWorkAllowed; }
    public void setWeekendWorkAllowed(Boolean weekendWorkAllowed) { this.weekendWorkAllowed = weekendWorkAllowed; }
    public Integer getMaxConsecutiveNights() { return maxConsecutiveNights; }
    public void setMaxConsecutiveNights(Integer maxConsecutiveNights) { this.maxConsecutiveNights = maxConsecutiveNights; }
    public Integer getMaxNightsPerWeek() { return maxNightsPerWeek; }
    public void setMaxNightsPerWeek(Integer maxNightsPerWeek) { this.maxNightsPerWeek = maxNightsPerWeek; }
    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }
}
