package com.example.shiftplanner.constraint.rules;

import com.example.shiftplanner.assignment.AssignmentSlot;
import com.example.shiftplanner.constraint.EvaluationContext;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.*;

final class Timelines {

    private Timelines() {
    }

    /**
     * Evaluated slots merged with the stored ones, per employee, ordered by shift start.
     */
    static Map<String, List<AssignmentSlot>> byEmployee(List<AssignmentSlot> slots, EvaluationContext context) {
        Set<String> evaluatedIds = new HashSet<>();
        Map<String, List<AssignmentSlot>> result = new TreeMap<>();
        for (AssignmentSlot slot : slots) {
            evaluatedIds.add(slot.assignment().getId());
            result.computeIfAbsent(slot.assignment().getEmployeeId(), k -> new ArrayList<>()).add(slot);
        }
        for (AssignmentSlot slot : context.existing()) {
            if (!slot.assignment().isActive() || evaluatedIds.contains(slot.assignment().getId())) {
                continue;
            }
            // stored work only matters for employees present in the evaluated set
            List<AssignmentSlot> timeline = result.get(slot.assignment().getEmployeeId());
            if (timeline != null) {
                timeline.add(slot);
            }
        }
        Comparator<AssignmentSlot> byStart = Comparator
                .comparing((AssignmentSlot s) -> s.window().startOn(s.date()))
                .thenComparing(s -> s.assignment().getId());
        result.values().forEach(list -> list.sort(byStart));
        return result;
    }

    static Set<String> ids(List<AssignmentSlot> slots) {
        Set<String> ids = new HashSet<>();
        slots.forEach(s -> ids.add(s.assignment().getId()));
        return ids;
    }

    static boolean touches(Collection<AssignmentSlot> involved, Set<String> evaluatedIds) {
        return involved.stream().anyMatch(s -> evaluatedIds.contains(s.assignment().getId()));
    }

    static List<String> idList(Collection<AssignmentSlot> involved) {
        return involved.stream().map(s -> s.assignment().getId()).toList();
    }

    static LocalDate weekOf(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    /**
     * Runs of consecutive calendar dates, each run in ascending order.
     */
    static List<List<LocalDate>> consecutiveRuns(SortedSet<LocalDate> dates) {
        List<List<LocalDate>> runs = new ArrayList<>();
        List<LocalDate> current = new ArrayList<>();
        for (LocalDate date : dates) {
            if (!current.isEmpty() && !current.get(current.size() - 1).plusDays(1).equals(date)) {
                runs.add(current);
                current = new ArrayList<>();
            }
            current.add(date);
        }
        if (!current.isEmpty()) {
            runs.add(current);
        }
        return runs;
    }
}
