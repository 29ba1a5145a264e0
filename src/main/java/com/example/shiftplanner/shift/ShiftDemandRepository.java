package com.example.shiftplanner.shift;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface ShiftDemandRepository extends JpaRepository<ShiftDemand, String> {

    List<ShiftDemand> findByDateBetweenOrderByDateAscIdAsc(LocalDate start, LocalDate end);

    List<ShiftDemand> findByDateOrderByIdAsc(LocalDate date);
}
