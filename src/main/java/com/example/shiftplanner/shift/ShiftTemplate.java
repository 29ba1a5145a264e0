package com.example.shiftplanner.shift;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalTime;

@Entity
@Table(name = "shift_templates")
public class ShiftTemplate {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 50)
    @NotBlank(message = "Shift name is required")
    private String name;

    @Column(name = "start_time", nullable = false)
    @NotNull(message = "Start time is required")
    private LocalTime startTime;

    // may be earlier than startTime for overnight shifts
    @Column(name = "end_time", nullable = false)
    @NotNull(message = "End time is required")
    private LocalTime endTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "shift_type", nullable = false, length = 20)
    private ShiftType shiftType = ShiftType.DAY;

    protected ShiftTemplate() {
    }

    public ShiftTemplate(String id, String name, LocalTime startTime, LocalTime endTime, ShiftType shiftType) {
        this.id = id;
        this.name = name;
        this.startTime = startTime;
        this.endTime = endTime;
        this.shiftType = shiftType;
    }

    public ShiftWindow window() {
        return ShiftWindow.of(startTime, endTime);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public LocalTime getStartTime() { return startTime; }
    public void setStartTime(LocalTime startTime) { this.startTime = startTime; }
    public LocalTime getEndTime() { return endTime; }
    public void setEndTime(LocalTime endTime) { this.endTime = endTime; }
    public ShiftType getShiftType() { return shiftType; }
    public void setShiftType(ShiftType shiftType) { this.shiftType = shiftType; }
}
