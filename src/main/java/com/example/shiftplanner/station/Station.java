package com.example.shiftplanner.station;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "stations")
public class Station {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 100)
    @NotBlank(message = "Station name is required")
    private String name;

    @Column(length = 50)
    private String line;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Priority priority = Priority.MEDIUM;

    @Column
    private Integer capacity = 1;

    @Column(nullable = false)
    private Boolean active = true;

    @OneToMany(mappedBy = "station", fetch = FetchType.EAGER, cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<StationSkillRequirement> requiredSkills = new ArrayList<>();

    protected Station() {
    }

    public Station(String id, String name, String line, Priority priority) {
        this.id = id;
        this.name = name;
        this.line = line;
        this.priority = priority;
    }

    public void addRequirement(StationSkillRequirement requirement) {
        requirement.setStation(this);
        requiredSkills.add(requirement);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getLine() { return line; }
    public void setLine(String line) { this.line = line; }
    public Priority getPriority() { return priority; }
    public void setPriority(Priority priority) { this.priority = priority; }
    public Integer getCapacity() { return capacity; }
    public void setCapacity(Integer capacity) { this.capacity = capacity; }
    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }
    public List<StationSkillRequirement> getRequiredSkills() { return requiredSkills; }
}
