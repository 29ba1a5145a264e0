package com.example.shiftplanner.sync;

import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Immutable checkpoint of a planning day. There are no setters for the captured state.
 */
@Entity
@Table(name = "planning_snapshots",
        uniqueConstraints = @UniqueConstraint(columnNames = {"snapshot_date", "snapshot_version"}))
public class PlanningSnapshot {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "snapshot_date", nullable = false)
    private LocalDate date;

    @Column(name = "snapshot_version", nullable = false)
    private Long version;

    @Lob
    @Column(name = "assignments_json", nullable = false)
    private String assignmentsJson;

    @Lob
    @Column(name = "conflicts_json")
    private String conflictsJson;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "created_by", length = 64)
    private String createdBy;

    protected PlanningSnapshot() {
    }

    public PlanningSnapshot(String id, LocalDate date, long version, String assignmentsJson, String conflictsJson,
                            Instant createdAt, String createdBy) {
        this.id = id;
        this.date = date;
        this.version = version;
        this.assignmentsJson = assignmentsJson;
        this.conflictsJson = conflictsJson;
        this.createdAt = createdAt;
        this.createdBy = createdBy;
    }

    public String getId() { return id; }
    public LocalDate getDate() { return date; }
    public Long getVersion() { return version; }
    public String getAssignmentsJson() { return assignmentsJson; }
    public String getConflictsJson() { return conflictsJson; }
    public Instant getCreatedAt() { return createdAt; }
    public String getCreatedBy() { return createdBy; }
}
