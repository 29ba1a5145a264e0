package com.example.shiftplanner.plan;

import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "plans")
public class Plan {

    @Id
    @Column(length = 64)
    private String id;

    @Column(length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private PlanStatus status = PlanStatus.DRAFT;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private PlanningStrategy strategy = PlanningStrategy.BALANCED;

    // coverage and violations are derived reports kept as JSON snapshots
    @Lob
    @Column(name = "coverage_json")
    private String coverageJson;

    @Lob
    @Column(name = "violations_json")
    private String violationsJson;

    @Column(length = 1000)
    private String explanation;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "created_by", length = 64)
    private String createdBy;

    @Column(name = "committed_at")
    private Instant committedAt;

    @Column(name = "committed_by", length = 64)
    private String committedBy;

    @Version
    private Long version;

    protected Plan() {
    }

    public Plan(String id, LocalDate startDate, LocalDate endDate, PlanningStrategy strategy) {
        this.id = id;
        this.startDate = startDate;
        this.endDate = endDate;
        this.strategy = strategy;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public PlanStatus getStatus() { return status; }
    public void setStatus(PlanStatus status) { this.status = status; }
    public LocalDate getStartDate() { return startDate; }
    public LocalDate getEndDate() { return endDate; }
    public PlanningStrategy getStrategy() { return strategy; }
    public String getCoverageJson() { return coverageJson; }
    public void setCoverageJson(String coverageJson) { this.coverageJson = coverageJson; }
    public String getViolationsJson() { return violationsJson; }
    public void setViolationsJson(String violationsJson) { this.violationsJson = violationsJson; }
    public String getExplanation() { return explanation; }
    public void setExplanation(String explanation) { this.explanation = explanation; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
    public Instant getCommittedAt() { return committedAt; }
    public void setCommittedAt(Instant committedAt) { this.committedAt = committedAt; }
    public String getCommittedBy() { return committedBy; }
    public void setCommittedBy(String committedBy) { this.committedBy = committedBy; }
    public Long getVersion() { return version; }
}
