package com.example.shiftplanner.employee;

import com.example.shiftplanner.skill.Skill;
import jakarta.persistence.*;

import java.time.LocalDate;

@Entity
@Table(name = "employee_skills",
        uniqueConstraints = @UniqueConstraint(columnNames = {"employee_id", "skill_id"}))
public class EmployeeSkill {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "employee_id", nullable = false)
    private Employee employee;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "skill_id", nullable = false)
    private Skill skill;

    @Column(nullable = false)
    private Integer level = 1;

    // certification expiry, null when the skill does not expire
    @Column(name = "valid_until")
    private LocalDate validUntil;

    protected EmployeeSkill() {
    }

    public EmployeeSkill(Employee employee, Skill skill, int level, LocalDate validUntil) {
        this.employee = employee;
        this.skill = skill;
        this.level = level;
        this.validUntil = validUntil;
    }

    public Long getId() { return id; }
    public Employee getEmployee() { return employee; }
    public Skill getSkill() { return skill; }
    public Integer getLevel() { return level; }
    public void setLevel(Integer level) { this.level = level; }
    public LocalDate getValidUntil() { return validUntil; }
    public void setValidUntil(LocalDate validUntil) { this.validUntil = validUntil; }
}
