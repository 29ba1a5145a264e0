package com.example.shiftplanner.employee;

import com.example.shiftplanner.shift.ShiftType;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;

@Entity
@Table(name = "employees")
public class Employee {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false)
    @NotBlank(message = "Employee name is required")
    @Size(max = 100, message = "Employee name must be at most 100 characters")
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "contract_type", nullable = false, length = 20)
    private ContractType contractType = ContractType.FULL_TIME;

    // weekly limit in hours
    @Column(name = "weekly_hours")
    private Integer weeklyHours = 40;

    @Column(name = "max_hours_per_day")
    private Integer maxHoursPerDay = 10;

    @Column(name = "min_rest_hours")
    private Integer minRestHours = 11;

    @Column(name = "max_consecutive_days")
    private Integer maxConsecutiveDays = 6;

    @Enumerated(EnumType.STRING)
    @Column(name = "preferred_shift_type", length = 20)
    private ShiftType preferredShiftType;

    @Column(length = 50)
    private String team;

    @Column(nullable = false)
    private Boolean active = true;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    protected Employee() {
    }

    public Employee(String id, String name, ContractType contractType) {
        this.id = id;
        this.name = name;
        this.contractType = contractType;
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    public boolean isActive() {
        return Boolean.TRUE.equals(active);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public ContractType getContractType() { return contractType; }
    public void setContractType(ContractType contractType) { this.contractType = contractType; }
    public Integer getWeeklyHours() { return weeklyHours; }
    public void setWeeklyHours(Integer weeklyHours) { this.weeklyHours = weeklyHours; }
    public Integer getMaxHoursPerDay() { return maxHoursPerDay; }
    public void setMaxHoursPerDay(Integer maxHoursPerDay) { this.maxHoursPerDay = maxHoursPerDay; }
    public Integer getMinRestHours() { return minRestHours; }
    public void setMinRestHours(Integer minRestHours) { this.minRestHours = minRestHours; }
    public Integer getMaxConsecutiveDays() { return maxConsecutiveDays; }
    public void setMaxConsecutiveDays(Integer maxConsecutiveDays) { this.maxConsecutiveDays = maxConsecutiveDays; }
    public ShiftType getPreferredShiftType() { return preferredShiftType; }
    public void setPreferredShiftType(ShiftType preferredShiftType) { this.preferredShiftType = preferredShiftType; }
    public String getTeam() { return team; }
    public void setTeam(String team) { this.team = team; }
    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }
}
