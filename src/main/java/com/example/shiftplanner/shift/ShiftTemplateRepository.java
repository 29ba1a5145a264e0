package com.example.shiftplanner.shift;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ShiftTemplateRepository extends JpaRepository<ShiftTemplate, String> {

    List<ShiftTemplate> findAllByOrderByStartTimeAsc();
}
