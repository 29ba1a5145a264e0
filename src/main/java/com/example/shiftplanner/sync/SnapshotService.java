package com.example.shiftplanner.sync;

import com.example.shiftplanner.assignment.AssignmentDto;
import com.example.shiftplanner.assignment.AssignmentStore;
import com.example.shiftplanner.exception.BusinessException;
import com.example.shiftplanner.exception.ConflictException;
import com.example.shiftplanner.exception.NotFoundException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Service
@Transactional
public class SnapshotService {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotService.class);

    private static final TypeReference<List<AssignmentDto>> ASSIGNMENTS = new TypeReference<>() {};
    private static final TypeReference<List<Conflict>> CONFLICTS = new TypeReference<>() {};

    private final PlanningSnapshotRepository snapshotRepository;
    private final AssignmentStore assignmentStore;
    private final PlanningDataService planningDataService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SnapshotService(PlanningSnapshotRepository snapshotRepository,
                           AssignmentStore assignmentStore,
                           PlanningDataService planningDataService,
                           ObjectMapper objectMapper,
                           Clock clock) {
        this.snapshotRepository = snapshotRepository;
        this.assignmentStore = assignmentStore;
        this.planningDataService = planningDataService;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public SnapshotDto create(SnapshotDto request, String userId) {
        String id = request.id() == null || request.id().isBlank() ? "snapshot-" + UUID.randomUUID() : request.id();
        if (snapshotRepository.existsById(id)) {
            throw new ConflictException("Snapshot %s already exists".formatted(id), id);
        }
        LocalDate date = request.date();
        List<AssignmentDto> assignments = request.assignments() != null
                ? request.assignments()
                : assignmentStore.findByDateRange(date, date).stream()
                    .filter(a -> a.isActive())
                    .map(AssignmentDto::from)
                    .toList();
        long version = snapshotRepository.findTopByDateOrderByVersionDesc(date)
                .map(s -> s.getVersion() + 1)
                .orElse(1L);
        Instant now = clock.instant();
        PlanningSnapshot snapshot = new PlanningSnapshot(id, date, version, write(assignments),
                request.conflicts() == null ? null : write(request.conflicts()), now, userId);
        snapshotRepository.save(snapshot);
        logger.info("Created snapshot {} for {} (version {}, {} assignments)", id, date, version, assignments.size());
        return toDto(snapshot);
    }

    @Transactional(readOnly = true)
    public List<SnapshotDto> list(LocalDate date) {
        List<PlanningSnapshot> snapshots = date == null
                ? snapshotRepository.findAllByOrderByCreatedAtDesc()
                : snapshotRepository.findByDateOrderByVersionAsc(date);
        return snapshots.stream().map(this::toDto).toList();
    }

    /**
     * Planning data for the snapshot's date with the captured assignments. The store is not touched.
     */
    @Transactional(readOnly = true)
    public PlanningData restore(String snapshotId) {
        PlanningSnapshot snapshot = snapshotRepository.findById(snapshotId)
                .orElseThrow(() -> NotFoundException.of("Snapshot", snapshotId));
        logger.info("Restoring snapshot {} for {}", snapshotId, snapshot.getDate());
        return planningDataService.loadWith(snapshot.getDate(), read(snapshot.getAssignmentsJson(), ASSIGNMENTS));
    }

    private SnapshotDto toDto(PlanningSnapshot snapshot) {
        List<Conflict> conflicts = snapshot.getConflictsJson() == null ? List.of() : read(snapshot.getConflictsJson(), CONFLICTS);
        return new SnapshotDto(snapshot.getId(), snapshot.getDate(), read(snapshot.getAssignmentsJson(), ASSIGNMENTS),
                snapshot.getVersion(), snapshot.getCreatedAt(), snapshot.getCreatedBy(), conflicts);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new BusinessException("SERIALIZATION_ERROR", HttpStatus.INTERNAL_SERVER_ERROR,
                    "Failed to serialize snapshot", e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new BusinessException("SERIALIZATION_ERROR", HttpStatus.INTERNAL_SERVER_ERROR,
                    "Failed to read stored snapshot", e);
        }
    }
}
