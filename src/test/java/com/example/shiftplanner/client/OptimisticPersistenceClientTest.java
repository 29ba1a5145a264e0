package com.example.shiftplanner.client;

import com.example.shiftplanner.assignment.AssignmentDto;
import com.example.shiftplanner.assignment.AssignmentStatus;
import com.example.shiftplanner.sync.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OptimisticPersistenceClientTest {

    private static final LocalDate MONDAY = LocalDate.of(2026, 3, 2);
    private static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private FakePlanningSyncGateway gateway;
    private ManualSyncScheduler scheduler;
    private OptimisticPersistenceClient client;
    private final List<PlanningChange> changes = new ArrayList<>();
    private final List<PersistenceError> errors = new ArrayList<>();
    private final List<Conflict> conflicts = new ArrayList<>();

    @BeforeEach
    void setUp() {
        gateway = new FakePlanningSyncGateway();
        scheduler = new ManualSyncScheduler();
        client = newClient(PersistenceClientSettings.DEFAULT_MAX_RETRIES);
    }

    private OptimisticPersistenceClient newClient(int maxRetries) {
        PersistenceClientSettings settings = new PersistenceClientSettings("http://localhost:8080/",
                Duration.ofMillis(500), "alice", "floor-1", maxRetries, Duration.ofSeconds(1));
        OptimisticPersistenceClient created = new OptimisticPersistenceClient(settings, gateway, scheduler,
                objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
        created.subscribeToChanges(changes::add);
        created.subscribeToErrors(errors::add);
        created.subscribeToConflicts(conflicts::add);
        return created;
    }

    @Test
    void saveAssignment_coalescesEditsIntoOneSync() {
        client.saveAssignment(assignment("a-1", 0.5));
        client.saveAssignment(assignment("a-1", 0.7));
        client.saveAssignment(assignment("a-1", 0.95));

        assertThat(scheduler.pendingCount()).isEqualTo(1);
        assertThat(scheduler.lastDelay()).isEqualTo(Duration.ofMillis(500));
        assertThat(client.getSyncState()).isEqualTo(SyncState.PENDING);
        assertThat(client.getOptimisticAssignments()).extracting(AssignmentDto::score).containsExactly(0.95);

        scheduler.runPending();

        assertThat(gateway.syncCalls).singleElement().satisfies(batch -> {
            assertThat(batch).hasSize(1);
            assertThat(batch.get(0).type()).isEqualTo(ChangeType.ADD);
            assertThat(batch.get(0).assignment().score()).isEqualTo(0.95);
        });
        assertThat(client.getOptimisticAssignments()).isEmpty();
        assertThat(client.getAssignments()).extracting(AssignmentDto::score).containsExactly(0.95);
        assertThat(client.getPendingChangeCount()).isZero();
        assertThat(client.getSyncState()).isEqualTo(SyncState.IDLE);
    }

    @Test
    void saveAssignment_notifiesAddThenUpdate() {
        client.saveAssignment(assignment("a-1", 0.5));
        client.saveAssignment(assignment("a-1", 0.6));

        assertThat(changes).extracting(PlanningChange::type).containsExactly(ChangeType.ADD, ChangeType.UPDATE);
        assertThat(changes).extracting(change -> change.assignment().score()).containsExactly(0.5, 0.6);
        assertThat(client.getOverlayEntry("a-1")).hasValueSatisfying(entry ->
                assertThat(entry.origin()).isEqualTo(ChangeOrigin.ADD));
    }

    @Test
    void saveAssignment_ofLoadedAssignment_sendsUpdate() {
        gateway.planningData = FakePlanningSyncGateway.dataWith(MONDAY, List.of(assignment("a-1", 0.5)));
        client.loadPlanningData(MONDAY);

        client.saveAssignment(assignment("a-1", 0.8));
        scheduler.runPending();

        assertThat(changes).extracting(PlanningChange::type).containsExactly(ChangeType.UPDATE);
        assertThat(gateway.syncCalls.get(0)).extracting(PlanningChange::type).containsExactly(ChangeType.UPDATE);
    }

    @Test
    void removeAssignment_ofUnknownId_throwsWithoutNetworkCall() {
        assertThatThrownBy(() -> client.removeAssignment("ghost"))
                .isInstanceOf(AssignmentNotFoundException.class)
                .satisfies(e -> assertThat(((PersistenceException) e).getError().type())
                        .isEqualTo(PersistenceError.Type.NOT_FOUND));

        assertThat(scheduler.scheduledCount()).isZero();
        assertThat(gateway.syncCalls).isEmpty();
        assertThat(changes).isEmpty();
    }

    @Test
    void removeAssignment_queuesDeleteForLoadedAssignment() {
        gateway.planningData = FakePlanningSyncGateway.dataWith(MONDAY, List.of(assignment("a-1", 0.5)));
        client.loadPlanningData(MONDAY);

        client.removeAssignment("a-1");

        assertThat(client.getAssignments()).isEmpty();
        assertThat(changes).singleElement().extracting(PlanningChange::type).isEqualTo(ChangeType.DELETE);
        scheduler.runPending();
        assertThat(gateway.syncCalls.get(0)).extracting(PlanningChange::type).containsExactly(ChangeType.DELETE);
    }

    @Test
    void rollbackOptimisticUpdates_emitsDeletePerLocalEdit() {
        client.saveAssignment(assignment("a-1", 0.5));
        client.saveAssignment(assignment("a-2", 0.5));
        changes.clear();

        client.rollbackOptimisticUpdates();

        assertThat(changes).hasSize(2).allSatisfy(change -> {
            assertThat(change.type()).isEqualTo(ChangeType.DELETE);
            assertThat(change.id()).startsWith("rollback-");
        });
        assertThat(client.getOptimisticAssignments()).isEmpty();
        assertThat(client.getPendingChangeCount()).isZero();
        assertThat(scheduler.pendingCount()).isZero();
        assertThat(client.getSyncState()).isEqualTo(SyncState.IDLE);
    }

    @Test
    void loadPlanningData_discardsLocalEditsEvenWhenCallFails() {
        client.saveAssignment(assignment("a-1", 0.5));

        assertThatThrownBy(() -> client.loadPlanningData(MONDAY)).isInstanceOf(NetworkException.class);

        assertThat(client.getOptimisticAssignments()).isEmpty();
        assertThat(client.getPendingChangeCount()).isZero();
        assertThat(errors).singleElement().satisfies(error -> {
            assertThat(error.type()).isEqualTo(PersistenceError.Type.NETWORK);
            assertThat(error.retryable()).isTrue();
        });
    }

    @Test
    void loadPlanningData_replacesServerView() {
        client.saveAssignment(assignment("a-9", 0.5));
        gateway.planningData = FakePlanningSyncGateway.dataWith(MONDAY,
                List.of(assignment("a-1", 0.5), assignment("a-2", 0.6)));

        PlanningData data = client.loadPlanningData(MONDAY);

        assertThat(data.assignments()).hasSize(2);
        assertThat(client.getAssignments()).extracting(AssignmentDto::id).containsExactly("a-1", "a-2");
    }

    @Test
    void offlineEdits_areQueuedAndFlushedOnReconnect() {
        client.setOnline(false);
        client.saveAssignment(assignment("a-1", 0.5));
        client.saveAssignment(assignment("a-2", 0.5));

        assertThat(scheduler.scheduledCount()).isZero();
        assertThat(client.getPendingChangeCount()).isEqualTo(2);
        assertThat(client.getSyncState()).isEqualTo(SyncState.IDLE);

        client.setOnline(true);

        assertThat(gateway.syncCalls).singleElement().satisfies(batch ->
                assertThat(batch).extracting(change -> change.assignment().id()).containsExactly("a-1", "a-2"));
        assertThat(client.getPendingChangeCount()).isZero();
    }

    @Test
    void goingOffline_cancelsPendingFlush() {
        client.saveAssignment(assignment("a-1", 0.5));

        client.setOnline(false);
        scheduler.runPending();

        assertThat(gateway.syncCalls).isEmpty();
        assertThat(client.isOnline()).isFalse();
        assertThat(client.getPendingChangeCount()).isEqualTo(1);
    }

    @Test
    void networkFailure_requeuesAndEmitsRetryableError() {
        gateway.failWith(new NetworkException("Connection refused", null));
        client.saveAssignment(assignment("a-1", 0.5));

        scheduler.runPending();

        assertThat(errors).singleElement().satisfies(error -> {
            assertThat(error.type()).isEqualTo(PersistenceError.Type.NETWORK);
            assertThat(error.retryable()).isTrue();
        });
        assertThat(client.getPendingChangeCount()).isEqualTo(1);
        assertThat(client.getOptimisticAssignments()).hasSize(1);

        client.forceSyncPendingChanges();

        assertThat(gateway.syncCalls).hasSize(2);
        assertThat(gateway.syncCalls.get(1).get(0).id()).isEqualTo(gateway.syncCalls.get(0).get(0).id());
        assertThat(client.getPendingChangeCount()).isZero();
        assertThat(client.getOptimisticAssignments()).isEmpty();
    }

    @Test
    void retries_areDroppedAfterMaxAttempts() {
        client = newClient(1);
        gateway.failWith(new NetworkException("Connection refused", null));
        gateway.failWith(new NetworkException("Connection refused", null));
        client.saveAssignment(assignment("a-1", 0.5));

        client.forceSyncPendingChanges();
        assertThat(client.getPendingChangeCount()).isEqualTo(1);
        client.forceSyncPendingChanges();

        assertThat(client.getPendingChangeCount()).isZero();
        assertThat(errors).hasSize(3);
        assertThat(errors.get(2).retryable()).isFalse();
        assertThat(errors.get(2).message()).contains("a-1");
    }

    @Test
    void nonRetryableFailure_isNotRequeued() {
        gateway.failWith(new PersistenceException(PersistenceError.Type.VALIDATION, "Malformed request", false));
        client.saveAssignment(assignment("a-1", 0.5));

        client.forceSyncPendingChanges();

        assertThat(client.getPendingChangeCount()).isZero();
        assertThat(errors).singleElement().extracting(PersistenceError::retryable).isEqualTo(false);
    }

    @Test
    void failedChangeResult_emitsValidationError() {
        gateway.replyWith(batch -> new SyncResponse(true, 1, 0,
                List.of(ChangeResult.failed(batch.get(0), "Demand d-9 not found")), List.of()));
        client.saveAssignment(assignment("a-1", 0.5));

        client.forceSyncPendingChanges();

        assertThat(errors).singleElement().satisfies(error -> {
            assertThat(error.type()).isEqualTo(PersistenceError.Type.VALIDATION);
            assertThat(error.message()).isEqualTo("Demand d-9 not found");
            assertThat(error.assignment().id()).isEqualTo("a-1");
        });
    }

    @Test
    void syncConflicts_reachConflictSubscribers() {
        Conflict conflict = new Conflict("conflict-c-1", ConflictType.DOUBLE_BOOKING, List.of("a-1", "a-0"),
                "Employee emp-1 is already assigned");
        gateway.replyWith(batch -> new SyncResponse(true, 0, 1, List.of(), List.of(conflict)));
        client.saveAssignment(assignment("a-1", 0.5));

        client.forceSyncPendingChanges();

        assertThat(conflicts).containsExactly(conflict);
        assertThat(client.getOptimisticAssignments()).extracting(AssignmentDto::id).containsExactly("a-1");
    }

    @Test
    void handleConflict_defaultsToAcceptLocal() {
        Conflict conflict = new Conflict("conflict-c-1", ConflictType.CONCURRENT_MODIFICATION, List.of("a-1"), "stale");

        assertThat(client.handleConflict(conflict).action()).isEqualTo(ResolutionAction.ACCEPT_LOCAL);
        assertThat(conflicts).containsExactly(conflict);

        client.setConflictResolver(c -> new ConflictResolution(ResolutionAction.ACCEPT_REMOTE, null));
        assertThat(client.handleConflict(conflict).action()).isEqualTo(ResolutionAction.ACCEPT_REMOTE);
    }

    @Test
    void editDuringFlight_waitsForNextWindow() {
        gateway.duringSync = () -> client.saveAssignment(assignment("a-2", 0.5));
        client.saveAssignment(assignment("a-1", 0.5));

        scheduler.runPending();

        assertThat(gateway.syncCalls).hasSize(1);
        assertThat(scheduler.pendingCount()).isEqualTo(1);
        assertThat(client.getSyncState()).isEqualTo(SyncState.PENDING);

        scheduler.runPending();

        assertThat(gateway.syncCalls).hasSize(2);
        assertThat(gateway.syncCalls.get(1)).extracting(change -> change.assignment().id()).containsExactly("a-2");
    }

    @Test
    void confirmedAdd_turnsPendingReEditIntoUpdate() {
        gateway.duringSync = () -> client.saveAssignment(assignment("a-1", 0.9));
        client.saveAssignment(assignment("a-1", 0.5));

        scheduler.runPending();

        assertThat(client.getOverlayEntry("a-1")).hasValueSatisfying(entry -> {
            assertThat(entry.origin()).isEqualTo(ChangeOrigin.UPDATE);
            assertThat(entry.assignment().score()).isEqualTo(0.9);
        });

        scheduler.runPending();

        assertThat(gateway.syncCalls.get(1)).singleElement().satisfies(change -> {
            assertThat(change.type()).isEqualTo(ChangeType.UPDATE);
            assertThat(change.assignment().score()).isEqualTo(0.9);
        });
        assertThat(client.getOptimisticAssignments()).isEmpty();
    }

    @Test
    void remoteChange_fromOtherUser_updatesViewUnlessEditedLocally() {
        client.onRealtimeMessage(remoteChange("bob", "a-1", 0.3));
        assertThat(client.getAssignments()).extracting(AssignmentDto::score).containsExactly(0.3);

        client.saveAssignment(assignment("a-1", 0.8));
        client.onRealtimeMessage(remoteChange("bob", "a-1", 0.1));

        assertThat(client.getAssignments()).extracting(AssignmentDto::score).containsExactly(0.8);
        assertThat(changes).hasSize(3);
    }

    @Test
    void remoteChange_fromSameUser_isIgnored() {
        client.onRealtimeMessage(remoteChange("alice", "a-1", 0.3));

        assertThat(client.getAssignments()).isEmpty();
        assertThat(changes).isEmpty();
    }

    @Test
    void remoteConflictNotice_reachesConflictSubscribers() {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", "conflict_detected");
        message.put("conflictId", "conflict-c-7");
        message.put("conflictType", "double_booking");
        message.put("affectedAssignments", List.of("a-1", "a-2"));
        message.put("message", "overlap");

        client.onRealtimeMessage(message);

        assertThat(conflicts).singleElement().satisfies(conflict -> {
            assertThat(conflict.id()).isEqualTo("conflict-c-7");
            assertThat(conflict.type()).isEqualTo(ConflictType.DOUBLE_BOOKING);
            assertThat(conflict.affectedAssignments()).containsExactly("a-1", "a-2");
        });
    }

    @Test
    void resolveConflict_appliesServerAnswerLocally() {
        client.saveAssignment(assignment("a-1", 0.5));
        AssignmentDto merged = assignment("a-1", 0.75);
        gateway.resolutionOutcome = new ConflictResolutionOutcome(true, "conflict-c-1", ResolutionAction.MERGE, merged, NOW);

        client.resolveConflict("conflict-c-1", new ConflictResolution(ResolutionAction.MERGE, merged));

        assertThat(gateway.resolveRequests).singleElement().satisfies(request -> {
            assertThat(request.userId()).isEqualTo("alice");
            assertThat(request.sessionId()).isEqualTo("floor-1");
        });
        assertThat(client.getOptimisticAssignments()).isEmpty();
        assertThat(client.getPendingChangeCount()).isZero();
        assertThat(client.getAssignments()).extracting(AssignmentDto::score).containsExactly(0.75);
    }

    @Test
    void createSnapshot_sendsMergedAssignments() {
        client.saveAssignment(assignment("a-1", 0.5));

        SnapshotDto snapshot = client.createSnapshot(MONDAY);

        assertThat(snapshot.version()).isEqualTo(1L);
        assertThat(gateway.snapshotRequests).singleElement().satisfies(request -> {
            assertThat(request.createdBy()).isEqualTo("alice");
            assertThat(request.assignments()).extracting(AssignmentDto::id).containsExactly("a-1");
        });
    }

    @Test
    void failingListener_doesNotStopOthers() {
        List<PlanningChange> seen = new ArrayList<>();
        client.subscribeToChanges(change -> {
            throw new IllegalStateException("listener bug");
        });
        Subscription subscription = client.subscribeToChanges(seen::add);

        client.saveAssignment(assignment("a-1", 0.5));
        subscription.cancel();
        client.saveAssignment(assignment("a-1", 0.6));

        assertThat(seen).hasSize(1);
        assertThat(changes).hasSize(2);
    }

    @Test
    void dispose_rejectsFurtherEdits() {
        client.dispose();

        assertThatThrownBy(() -> client.saveAssignment(assignment("a-1", 0.5)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rollback_afterRemove_restoresServerCopy() {
        gateway.planningData = FakePlanningSyncGateway.dataWith(MONDAY, List.of(assignment("a-1", 0.5)));
        client.loadPlanningData(MONDAY);
        client.removeAssignment("a-1");
        changes.clear();

        client.rollbackOptimisticUpdates();

        assertThat(client.getAssignments()).extracting(AssignmentDto::id).containsExactly("a-1");
        assertThat(changes).singleElement().satisfies(change -> {
            assertThat(change.type()).isEqualTo(ChangeType.UPDATE);
            assertThat(change.assignment().score()).isEqualTo(0.5);
        });
        assertThat(client.getPendingChangeCount()).isZero();
        assertThat(gateway.syncCalls).isEmpty();
    }

    @Test
    void saveAfterRemove_showsAssignmentAgainAsAdd() {
        gateway.planningData = FakePlanningSyncGateway.dataWith(MONDAY, List.of(assignment("a-1", 0.5)));
        client.loadPlanningData(MONDAY);
        client.removeAssignment("a-1");

        client.saveAssignment(assignment("a-1", 0.8));

        assertThat(client.getAssignments()).extracting(AssignmentDto::score).containsExactly(0.8);
        assertThat(changes).extracting(PlanningChange::type).containsExactly(ChangeType.DELETE, ChangeType.ADD);
        scheduler.runPending();
        assertThat(gateway.syncCalls).singleElement().satisfies(batch ->
                assertThat(batch).extracting(PlanningChange::type).containsExactly(ChangeType.UPDATE));
    }

    @Test
    void removeDuringFlight_keepsConfirmedAddOutOfView() {
        gateway.duringSync = () -> client.removeAssignment("a-1");
        client.saveAssignment(assignment("a-1", 0.5));

        scheduler.runPending();

        assertThat(client.getAssignments()).isEmpty();
        assertThat(client.getPendingChangeCount()).isEqualTo(1);

        scheduler.runPending();

        assertThat(gateway.syncCalls.get(1)).extracting(PlanningChange::type).containsExactly(ChangeType.DELETE);
        assertThat(client.getAssignments()).isEmpty();
        assertThat(client.getPendingChangeCount()).isZero();
    }

    @Test
    void networkFailure_schedulesRetryWithBackoff() {
        gateway.failWith(new NetworkException("Connection refused", null));
        gateway.failWith(new NetworkException("Connection refused", null));
        client.saveAssignment(assignment("a-1", 0.5));

        scheduler.runPending();

        assertThat(scheduler.pendingCount()).isEqualTo(1);
        assertThat(scheduler.lastDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(client.getSyncState()).isEqualTo(SyncState.PENDING);

        scheduler.runPending();

        assertThat(scheduler.pendingCount()).isEqualTo(1);
        assertThat(scheduler.lastDelay()).isEqualTo(Duration.ofSeconds(2));

        scheduler.runPending();

        assertThat(gateway.syncCalls).hasSize(3);
        assertThat(scheduler.pendingCount()).isZero();
        assertThat(client.getPendingChangeCount()).isZero();
        assertThat(client.getOptimisticAssignments()).isEmpty();
        assertThat(errors).hasSize(2).allSatisfy(error -> assertThat(error.retryable()).isTrue());
    }

    private static AssignmentDto assignment(String id, double score) {
        return new AssignmentDto(id, "d-early", "emp-1", null, AssignmentStatus.PROPOSED, score,
                null, null, null, null);
    }

    private static Map<String, Object> remoteChange(String userId, String assignmentId, double score) {
        Map<String, Object> assignment = new LinkedHashMap<>();
        assignment.put("id", assignmentId);
        assignment.put("demandId", "d-early");
        assignment.put("employeeId", "emp-2");
        assignment.put("status", "proposed");
        assignment.put("score", score);
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", "assignment_change");
        message.put("changeType", "update");
        message.put("changeId", "remote-" + score);
        message.put("assignment", assignment);
        message.put("userId", userId);
        message.put("timestamp", "2026-03-01T09:00:00Z");
        return message;
    }
}
