package com.example.shiftplanner.employee;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WorkingHourRuleRepository extends JpaRepository<WorkingHourRule, Long> {

    List<WorkingHourRule> findByActiveTrue();
}
