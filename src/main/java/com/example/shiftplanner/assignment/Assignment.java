package com.example.shiftplanner.assignment;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "assignments", indexes = {
        @Index(name = "idx_assignment_employee", columnList = "employee_id"),
        @Index(name = "idx_assignment_demand", columnList = "demand_id"),
        @Index(name = "idx_assignment_plan", columnList = "plan_id")
})
public class Assignment {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "demand_id", nullable = false, length = 64)
    private String demandId;

    @Column(name = "employee_id", nullable = false, length = 64)
    private String employeeId;

    @Column(name = "plan_id", length = 64)
    private String planId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AssignmentStatus status = AssignmentStatus.PROPOSED;

    @Column
    private Double score = 0.0;

    @Column(length = 1000)
    private String explanation;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "created_by", length = 64)
    private String createdBy;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    protected Assignment() {
    }

    public Assignment(String id, String demandId, String employeeId) {
        this.id = id;
        this.demandId = demandId;
        this.employeeId = employeeId;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public boolean isActive() {
        return AssignmentStatus.ACTIVE.contains(status);
    }

    public String getId() { return id; }
    public String getDemandId() { return demandId; }
    public void setDemandId(String demandId) { this.demandId = demandId; }
    public String getEmployeeId() { return employeeId; }
    public void setEmployeeId(String employeeId) { this.employeeId = employeeId; }
    public String getPlanId() { return planId; }
    public void setPlanId(String planId) { this.planId = planId; }
    public AssignmentStatus getStatus() { return status; }
    public void setStatus(AssignmentStatus status) { this.status = status; }
    public Double getScore() { return score; }
    public void setScore(Double score) { this.score = score; }
    public String getExplanation() { return explanation; }
    public void setExplanation(String explanation) { this.explanation = explanation; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public Long getVersion() { return version; }
}
