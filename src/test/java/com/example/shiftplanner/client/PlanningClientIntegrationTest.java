package com.example.shiftplanner.client;

import com.example.shiftplanner.PlanningTestData;
import com.example.shiftplanner.assignment.AssignmentDto;
import com.example.shiftplanner.assignment.AssignmentRepository;
import com.example.shiftplanner.assignment.AssignmentStatus;
import com.example.shiftplanner.realtime.ConnectionRegistry;
import com.example.shiftplanner.shift.ShiftTemplate;
import com.example.shiftplanner.station.Priority;
import com.example.shiftplanner.station.Station;
import com.example.shiftplanner.sync.ChangeType;
import com.example.shiftplanner.sync.Conflict;
import com.example.shiftplanner.sync.ConflictType;
import com.example.shiftplanner.sync.PlanningChange;
import com.example.shiftplanner.sync.PlanningData;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static com.example.shiftplanner.PlanningFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(PlanningTestData.class)
class PlanningClientIntegrationTest {

    private static final String SESSION = "floor-1";

    @LocalServerPort
    private int port;

    @Autowired
    private RestTemplateBuilder restTemplateBuilder;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TaskScheduler taskScheduler;

    @Autowired
    private Clock clock;

    @Autowired
    private AssignmentRepository assignmentRepository;

    @Autowired
    private ConnectionRegistry connectionRegistry;

    @Autowired
    private PlanningTestData data;

    private OptimisticPersistenceClient alice;
    private OptimisticPersistenceClient bob;

    @BeforeEach
    void setUp() {
        data.clear();
        Station station = data.station(station("st-1", Priority.HIGH));
        ShiftTemplate early = data.template(early());
        ShiftTemplate midday = data.template(midday());
        ShiftTemplate late = data.template(late());
        data.demand("d-early", MONDAY, station, early, 1);
        data.demand("d-midday", MONDAY, station, midday, 1);
        data.demand("d-late", MONDAY, station, late, 1);
        data.employee("emp-1");
        data.employee("emp-2");

        alice = client("alice");
        bob = client("bob");
    }

    @AfterEach
    void tearDown() {
        alice.dispose();
        bob.dispose();
    }

    @Test
    void debouncedSave_reachesServerAndOtherPlanner() throws Exception {
        connectBoth();
        CountDownLatch relayed = new CountDownLatch(1);
        List<PlanningChange> seenByBob = new CopyOnWriteArrayList<>();
        bob.subscribeToChanges(change -> {
            seenByBob.add(change);
            relayed.countDown();
        });

        alice.saveAssignment(assignment("a-1", "d-early", "emp-1", 0.95));

        assertThat(relayed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seenByBob.get(0).type()).isEqualTo(ChangeType.ADD);
        assertThat(seenByBob.get(0).assignment().score()).isEqualTo(0.95);
        awaitUntil(() -> assignmentRepository.findById("a-1").isPresent());
        awaitUntil(() -> alice.getPendingChangeCount() == 0);
        assertThat(assignmentRepository.findById("a-1").orElseThrow().getCreatedBy()).isEqualTo("alice");
        assertThat(bob.getAssignments()).extracting(AssignmentDto::id).containsExactly("a-1");
    }

    @Test
    void doubleBooking_isReportedToConflictSubscribers() {
        data.assignment("a-1", "d-early", "emp-1", AssignmentStatus.CONFIRMED, NOW);
        List<Conflict> conflicts = new CopyOnWriteArrayList<>();
        bob.subscribeToConflicts(conflicts::add);

        bob.saveAssignment(assignment("a-2", "d-midday", "emp-1", 0.6));
        bob.saveAssignment(assignment("a-3", "d-late", "emp-2", 0.6));
        bob.forceSyncPendingChanges();

        awaitUntil(() -> !conflicts.isEmpty());
        assertThat(conflicts.get(0).type()).isEqualTo(ConflictType.DOUBLE_BOOKING);
        assertThat(conflicts.get(0).affectedAssignments()).containsExactly("a-2", "a-1");
        assertThat(assignmentRepository.findById("a-3")).isPresent();
        assertThat(assignmentRepository.findById("a-2")).isEmpty();
        assertThat(bob.getOverlayEntry("a-2")).isPresent();
    }

    @Test
    void loadPlanningData_readsServerView() {
        data.assignment("a-1", "d-early", "emp-1", AssignmentStatus.PROPOSED, NOW);

        PlanningData loaded = alice.loadPlanningData(MONDAY);

        assertThat(loaded.assignments()).extracting(AssignmentDto::id).containsExactly("a-1");
        assertThat(loaded.coverageStatus()).hasSize(3);
        assertThat(alice.getAssignments()).extracting(AssignmentDto::id).containsExactly("a-1");
    }

    @Test
    void restoreOfUnknownSnapshot_surfacesNotFound() {
        List<PersistenceError> errors = new CopyOnWriteArrayList<>();
        alice.subscribeToErrors(errors::add);

        assertThatThrownBy(() -> alice.restoreFromSnapshot("missing"))
                .isInstanceOf(PersistenceException.class);

        assertThat(errors).singleElement().satisfies(error -> {
            assertThat(error.type()).isEqualTo(PersistenceError.Type.NOT_FOUND);
            assertThat(error.retryable()).isFalse();
        });
    }

    @Test
    void unreachableServer_isRetryableNetworkError() {
        PersistenceClientSettings settings = new PersistenceClientSettings("http://localhost:1",
                Duration.ofMillis(50), "carol", null, 3, Duration.ofMinutes(1));
        OptimisticPersistenceClient offline = new OptimisticPersistenceClient(settings,
                new RestPlanningSyncGateway(restTemplateBuilder.build(), objectMapper, settings),
                new TaskSchedulerSyncScheduler(taskScheduler, clock), objectMapper, clock);
        List<PersistenceError> errors = new CopyOnWriteArrayList<>();
        offline.subscribeToErrors(errors::add);

        offline.saveAssignment(assignment("a-1", "d-early", "emp-1", 0.5));
        offline.forceSyncPendingChanges();

        assertThat(errors).isNotEmpty();
        assertThat(errors.get(0).type()).isEqualTo(PersistenceError.Type.NETWORK);
        assertThat(errors.get(0).retryable()).isTrue();
        assertThat(offline.getPendingChangeCount()).isEqualTo(1);
        offline.dispose();
    }

    private OptimisticPersistenceClient client(String userId) {
        PersistenceClientSettings settings = new PersistenceClientSettings("http://localhost:" + port,
                Duration.ofMillis(100), userId, SESSION, 3, Duration.ofSeconds(1));
        return new OptimisticPersistenceClient(settings,
                new RestPlanningSyncGateway(restTemplateBuilder.build(), objectMapper, settings),
                new TaskSchedulerSyncScheduler(taskScheduler, clock),
                new WebSocketRealtimeLink(new StandardWebSocketClient(), objectMapper, settings),
                objectMapper,
                clock);
    }

    private void connectBoth() {
        alice.connectRealtime();
        bob.connectRealtime();
        awaitUntil(() -> connectionRegistry.members(SESSION).size() == 2);
    }

    private static AssignmentDto assignment(String id, String demandId, String employeeId, double score) {
        return new AssignmentDto(id, demandId, employeeId, null, AssignmentStatus.PROPOSED, score,
                null, null, null, null);
    }

    private static void awaitUntil(BooleanSupplier condition) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within 5 seconds");
            }
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted while waiting", e);
            }
        }
    }
}
