package com.example.shiftplanner.station;

import com.example.shiftplanner.skill.Skill;
import jakarta.persistence.*;

@Entity
@Table(name = "station_skill_requirements")
public class StationSkillRequirement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "station_id", nullable = false)
    private Station station;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "skill_id", nullable = false)
    private Skill skill;

    @Column(name = "min_level", nullable = false)
    private Integer minLevel = 1;

    @Column(nullable = false)
    private Boolean mandatory = true;

    protected StationSkillRequirement() {
    }

    public StationSkillRequirement(Skill skill, int minLevel, boolean mandatory) {
        this.skill = skill;
        this.minLevel = minLevel;
        this.mandatory = mandatory;
    }

    public Long getId() { return id; }
    public Station getStation() { return station; }
    void setStation(Station station) { this.station = station; }
    public Skill getSkill() { return skill; }
    public Integer getMinLevel() { return minLevel; }
    public void setMinLevel(Integer minLevel) { this.minLevel = minLevel; }
    public Boolean getMandatory() { return mandatory; }
    public void setMandatory(Boolean mandatory) { this.mandatory = mandatory; }
}
