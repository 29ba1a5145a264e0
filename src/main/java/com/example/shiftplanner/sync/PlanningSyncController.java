package com.example.shiftplanner.sync;

import com.example.shiftplanner.assignment.AssignmentStats;
import com.example.shiftplanner.assignment.AssignmentStore;
import com.example.shiftplanner.config.PlanningSettings;
import com.example.shiftplanner.exception.ValidationException;
import com.example.shiftplanner.realtime.CollaborationHub;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/planning")
public class PlanningSyncController {

    private static final Logger logger = LoggerFactory.getLogger(PlanningSyncController.class);

    public static final String USER_HEADER = "X-User-Id";
    public static final String SESSION_HEADER = "X-Planning-Session";

    private final SyncReconciler syncReconciler;
    private final PlanningDataService planningDataService;
    private final SnapshotService snapshotService;
    private final ConflictResolutionService conflictResolutionService;
    private final AssignmentStore assignmentStore;
    private final CollaborationHub hub;
    private final PlanningSettings settings;
    private final Clock clock;

    public PlanningSyncController(SyncReconciler syncReconciler,
                                  PlanningDataService planningDataService,
                                  SnapshotService snapshotService,
                                  ConflictResolutionService conflictResolutionService,
                                  AssignmentStore assignmentStore,
                                  CollaborationHub hub,
                                  PlanningSettings settings,
                                  Clock clock) {
        this.syncReconciler = syncReconciler;
        this.planningDataService = planningDataService;
        this.snapshotService = snapshotService;
        this.conflictResolutionService = conflictResolutionService;
        this.assignmentStore = assignmentStore;
        this.hub = hub;
        this.settings = settings;
        this.clock = clock;
    }

    @PostMapping("/sync")
    public ResponseEntity<SyncResponse> sync(@Valid @RequestBody SyncRequest request,
                                             @RequestHeader(value = USER_HEADER, required = false) String userId,
                                             @RequestHeader(value = SESSION_HEADER, required = false) String sessionId) {
        SyncResponse response = syncReconciler.sync(request.changes(), resolveUser(userId));
        if (sessionId != null && !sessionId.isBlank()) {
            response.conflicts().forEach(conflict -> hub.broadcastConflict(sessionId, conflict));
        }
        HttpStatus status = response.hasConflicts() ? HttpStatus.CONFLICT : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }

    @GetMapping("/data/{date}")
    public ResponseEntity<PlanningData> data(@PathVariable("date") String date) {
        return ResponseEntity.ok(planningDataService.load(parseDate(date)));
    }

    @PostMapping("/snapshots")
    public ResponseEntity<SnapshotDto> createSnapshot(@Valid @RequestBody SnapshotDto request,
                                                      @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(snapshotService.create(request, resolveUser(userId)));
    }

    @GetMapping("/snapshots")
    public ResponseEntity<List<SnapshotDto>> listSnapshots(@RequestParam(value = "date", required = false) String date) {
        return ResponseEntity.ok(snapshotService.list(date == null ? null : parseDate(date)));
    }

    @PostMapping("/snapshots/{id}/restore")
    public ResponseEntity<PlanningData> restoreSnapshot(@PathVariable("id") String id) {
        return ResponseEntity.ok(snapshotService.restore(id));
    }

    @PostMapping("/conflicts/{id}/resolve")
    public ResponseEntity<ConflictResolutionOutcome> resolveConflict(@PathVariable("id") String conflictId,
                                                                     @Valid @RequestBody ResolveConflictRequest request,
                                                                     @RequestHeader(value = USER_HEADER, required = false) String headerUser) {
        String userId = request.userId() != null && !request.userId().isBlank() ? request.userId() : resolveUser(headerUser);
        return ResponseEntity.ok(conflictResolutionService.resolve(conflictId, request, userId));
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        LocalDate today = LocalDate.now(clock);
        AssignmentStats stats = assignmentStore.getAssignmentStats(today, today);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("status", "operational");
        body.put("timestamp", clock.instant());
        body.put("stats", stats);
        body.put("websocket", hub.getSessionStats());
        return ResponseEntity.ok(body);
    }

    private String resolveUser(String userId) {
        return userId == null || userId.isBlank() ? settings.getDefaultUser() : userId;
    }

    private static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            logger.warn("Rejected date parameter '{}'", value);
            throw new ValidationException("Invalid date format: " + value + " (expected yyyy-MM-dd)", value);
        }
    }
}
