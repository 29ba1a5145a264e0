package com.example.shiftplanner.employee;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface EmployeeSkillRepository extends JpaRepository<EmployeeSkill, Long> {

    @Query("SELECT es FROM EmployeeSkill es WHERE es.employee.id IN :employeeIds")
    List<EmployeeSkill> findByEmployeeIds(@Param("employeeIds") Collection<String> employeeIds);
}
