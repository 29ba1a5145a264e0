package com.example.shiftplanner.shift;

import com.example.shiftplanner.station.Priority;
import com.example.shiftplanner.station.Station;
import jakarta.persistence.*;

import java.time.LocalDate;

/**
 * A demand slot: {@code requiredCount} workers at a station for one shift on one date.
 */
@Entity
@Table(name = "shift_demands", indexes = {
        @Index(name = "idx_demand_date", columnList = "demand_date")
})
public class ShiftDemand {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "demand_date", nullable = false)
    private LocalDate date;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "station_id", nullable = false)
    private Station station;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "shift_template_id", nullable = false)
    private ShiftTemplate shiftTemplate;

    @Column(name = "required_count", nullable = false)
    private Integer requiredCount = 1;

    // overrides the station priority when set
    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private Priority priority;

    protected ShiftDemand() {
    }

    public ShiftDemand(String id, LocalDate date, Station station, ShiftTemplate shiftTemplate, int requiredCount) {
        this.id = id;
        this.date = date;
        this.station = station;
        this.shiftTemplate = shiftTemplate;
        this.requiredCount = requiredCount;
    }

    public Priority effectivePriority() {
        if (priority != null) {
            return priority;
        }
        return station.getPriority() == null ? Priority.MEDIUM : station.getPriority();
    }

    public ShiftWindow window() {
        return shiftTemplate.window();
    }

    public String getId() { return id; }
    public LocalDate getDate() { return date; }
    public Station getStation() { return station; }
    public ShiftTemplate getShiftTemplate() { return shiftTemplate; }
    public Integer getRequiredCount() { return requiredCount; }
    public void setRequiredCount(Integer requiredCount) { this.requiredCount = requiredCount; }
    public Priority getPriority() { return priority; }
    public void setPriority(Priority priority) { this.priority = priority; }
}
