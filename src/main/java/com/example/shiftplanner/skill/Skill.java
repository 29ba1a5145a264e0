package com.example.shiftplanner.skill;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;

import java.time.LocalDateTime;

@Entity
@Table(name = "skills")
public class Skill {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 100)
    @NotBlank(message = "Skill name is required")
    private String name;

    @Column(length = 200)
    private String description;

    // highest level on this skill's scale
    @Column(name = "level_scale")
    private Integer levelScale = 5;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    protected Skill() {}

    public Skill(String id, String name, String description) {
        this.id = id;
        this.name = name;
        this.description = description;
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public Integer getLevelScale() { return levelScale; }
    public void setLevelScale(Integer levelScale) { this.levelScale = levelScale; }
    public LocalDateTime getCreatedAt() { return createdAt; }
}
