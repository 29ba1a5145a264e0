package com.example.shiftplanner.employee;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface AbsenceRepository extends JpaRepository<Absence, Long> {

    @Query("SELECT a FROM Absence a WHERE a.approved = true AND a.dateStart <= :end AND a.dateEnd >= :start")
    List<Absence> findApprovedOverlapping(@Param("start") LocalDate start, @Param("end") LocalDate end);
}
