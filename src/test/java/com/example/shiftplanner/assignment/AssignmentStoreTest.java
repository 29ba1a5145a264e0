package com.example.shiftplanner.assignment;

import com.example.shiftplanner.PlanningTestData;
import com.example.shiftplanner.shift.ShiftTemplate;
import com.example.shiftplanner.shift.ShiftType;
import com.example.shiftplanner.station.Priority;
import com.example.shiftplanner.station.Station;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalTime;

import static com.example.shiftplanner.PlanningFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@SpringBootTest
@Transactional
@Import(PlanningTestData.class)
class AssignmentStoreTest {

    @Autowired
    private AssignmentStore store;

    @Autowired
    private PlanningTestData data;

    private Station station;
    private ShiftTemplate early;
    private ShiftTemplate late;
    private ShiftTemplate night;

    @BeforeEach
    void setUp() {
        data.clear();
        station = data.station(station("st-1", Priority.MEDIUM));
        early = data.template(early());
        late = data.template(late());
        night = data.template(night());
        data.employee("emp-1");
        data.employee("emp-2");
        data.demand("d-early", MONDAY, station, early, 2);
        data.demand("d-late", MONDAY, station, late, 1);
        data.demand("d-night", MONDAY, station, night, 1);
    }

    @Test
    void findConflicting_returnsActiveOverlappingAssignmentsOnly() {
        data.assignment("a-early", "d-early", "emp-1", AssignmentStatus.CONFIRMED, NOW);
        data.assignment("a-rejected", "d-late", "emp-1", AssignmentStatus.REJECTED, NOW);

        assertThat(store.findConflicting("emp-1", MONDAY, LocalTime.of(10, 0), LocalTime.of(18, 0)))
                .extracting(Assignment::getId)
                .containsExactly("a-early");
        assertThat(store.findConflicting("emp-1", MONDAY, LocalTime.of(14, 0), LocalTime.of(22, 0))).isEmpty();
        assertThat(store.findConflicting("emp-2", MONDAY, LocalTime.of(6, 0), LocalTime.of(14, 0))).isEmpty();
        assertThat(store.findConflicting("emp-1", MONDAY.plusDays(1), LocalTime.of(6, 0), LocalTime.of(14, 0))).isEmpty();
    }

    @Test
    void findConflicting_handlesWindowsCrossingMidnight() {
        data.assignment("a-night", "d-night", "emp-1", AssignmentStatus.PROPOSED, NOW);

        assertThat(store.findConflicting("emp-1", MONDAY, LocalTime.of(20, 0), LocalTime.of(4, 0)))
                .extracting(Assignment::getId)
                .containsExactly("a-night");
        assertThat(store.findConflicting("emp-1", MONDAY, LocalTime.of(14, 0), LocalTime.of(22, 0))).isEmpty();
    }

    @Test
    void findConflicting_excludesTheAssignmentItself() {
        data.assignment("a-early", "d-early", "emp-1", AssignmentStatus.CONFIRMED, NOW);

        assertThat(store.findConflicting("emp-1", MONDAY, early.window(), "a-early")).isEmpty();
    }

    @Test
    void upsert_createsThenUpdates() {
        AssignmentDto dto = new AssignmentDto("a-new", "d-early", "emp-2", null, null, 0.7, null, null, null, null);

        Assignment created = store.upsert(dto, "alice", NOW);
        assertThat(created.getStatus()).isEqualTo(AssignmentStatus.PROPOSED);
        assertThat(created.getCreatedBy()).isEqualTo("alice");

        Assignment updated = store.upsert(dto.withScore(0.9).withStatus(AssignmentStatus.CONFIRMED), "bob",
                NOW.plusSeconds(60));
        assertThat(updated.getScore()).isEqualTo(0.9);
        assertThat(updated.getStatus()).isEqualTo(AssignmentStatus.CONFIRMED);
        assertThat(updated.getCreatedBy()).isEqualTo("alice");
        assertThat(updated.getUpdatedAt()).isEqualTo(NOW.plusSeconds(60));
    }

    @Test
    void delete_reportsWhetherAnythingWasRemoved() {
        data.assignment("a-early", "d-early", "emp-1", AssignmentStatus.PROPOSED, NOW);

        assertThat(store.delete("a-early")).isTrue();
        assertThat(store.delete("a-early")).isFalse();
        assertThat(store.findById("a-early")).isEmpty();
    }

    @Test
    void getAssignmentStats_countsHoursForActiveAssignments() {
        data.assignment("a-1", "d-early", "emp-1", AssignmentStatus.CONFIRMED, NOW);
        data.assignment("a-2", "d-night", "emp-2", AssignmentStatus.PROPOSED, NOW);
        data.assignment("a-3", "d-late", "emp-1", AssignmentStatus.REJECTED, NOW);

        AssignmentStats stats = store.getAssignmentStats(MONDAY, MONDAY);

        assertThat(stats.totalAssignments()).isEqualTo(3);
        assertThat(stats.byStatus())
                .containsEntry("proposed", 1L)
                .containsEntry("confirmed", 1L)
                .containsEntry("rejected", 1L);
        assertThat(stats.byEmployee())
                .extracting(AssignmentStats.EmployeeWorkload::employeeId, AssignmentStats.EmployeeWorkload::count,
                        AssignmentStats.EmployeeWorkload::totalHours)
                .containsExactly(
                        tuple("emp-1", 1L, 8.0),
                        tuple("emp-2", 1L, 8.0));
        assertThat(stats.totalHours()).isEqualTo(16.0);
        assertThat(stats.averageScore()).isEqualTo(0.5);
    }

    @Test
    void shiftTemplateKeepsItsType() {
        assertThat(night.getShiftType()).isEqualTo(ShiftType.NIGHT);
        assertThat(night.window().crossesMidnight()).isTrue();
    }
}
