package com.example.shiftplanner.sync;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface PlanningSnapshotRepository extends JpaRepository<PlanningSnapshot, String> {

    Optional<PlanningSnapshot> findTopByDateOrderByVersionDesc(LocalDate date);

    List<PlanningSnapshot> findByDateOrderByVersionAsc(LocalDate date);

    List<PlanningSnapshot> findAllByOrderByCreatedAtDesc();
}
