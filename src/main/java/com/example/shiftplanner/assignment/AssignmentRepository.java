package com.example.shiftplanner.assignment;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AssignmentRepository extends JpaRepository<Assignment, String> {

    List<Assignment> findByPlanIdOrderByIdAsc(String planId);

    List<Assignment> findByPlanIdAndStatus(String planId, AssignmentStatus status);

    long deleteByPlanIdAndStatusNot(String planId, AssignmentStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Assignment a WHERE a.id = :id")
    Optional<Assignment> findForUpdate(@Param("id") String id);

    // rows are [Assignment, ShiftDemand]
    @Query("SELECT a, d FROM Assignment a, ShiftDemand d " +
           "WHERE a.demandId = d.id AND a.employeeId = :employeeId AND d.date = :date " +
           "AND a.status IN :statuses ORDER BY a.id")
    List<Object[]> findSlotsForEmployeeOnDate(@Param("employeeId") String employeeId,
                                              @Param("date") LocalDate date,
                                              @Param("statuses") Collection<AssignmentStatus> statuses);

    @Query("SELECT a, d FROM Assignment a, ShiftDemand d " +
           "WHERE a.demandId = d.id AND d.date BETWEEN :start AND :end ORDER BY d.date, a.id")
    List<Object[]> findSlotsByDateRange(@Param("start") LocalDate start, @Param("end") LocalDate end);

    @Query("SELECT a, d FROM Assignment a, ShiftDemand d " +
           "WHERE a.demandId = d.id AND a.employeeId = :employeeId AND d.date BETWEEN :start AND :end " +
           "ORDER BY d.date, a.id")
    List<Object[]> findSlotsForEmployee(@Param("employeeId") String employeeId,
                                        @Param("start") LocalDate start,
                                        @Param("end") LocalDate end);
}
