package com.example.shiftplanner.plan;

import com.example.shiftplanner.shift.ShiftDemand;
import com.example.shiftplanner.shift.ShiftTemplate;
import com.example.shiftplanner.station.Priority;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class CoverageCalculator {

    private static final List<String> GAP_ACTIONS = List.of(
            "Adjust shift requirements",
            "Contact temporary staffing",
            "Approve overtime for qualified employees");

    private CoverageCalculator() {
    }

    /**
     * @param filled active assignments per demand id, stored and newly proposed together
     */
    public static CoverageStatus compute(List<ShiftDemand> demands, Map<String, Integer> filled) {
        int required = 0;
        int staffed = 0;
        int fullyCovered = 0;
        boolean criticalGap = false;
        List<CoverageGap> gaps = new ArrayList<>();
        for (ShiftDemand demand : demands.stream().sorted(GreedyPlanSolver.SLOT_ORDER).toList()) {
            int need = demand.getRequiredCount();
            int have = filled.getOrDefault(demand.getId(), 0);
            required += need;
            staffed += Math.min(need, have);
            if (have >= need) {
                fullyCovered++;
                continue;
            }
            Priority criticality = demand.effectivePriority();
            criticalGap |= criticality == Priority.CRITICAL;
            gaps.add(new CoverageGap(
                    demand.getId(),
                    demand.getStation().getId(),
                    demand.getStation().getName(),
                    demand.getDate(),
                    shiftTime(demand.getShiftTemplate()),
                    criticality,
                    need,
                    have,
                    have == 0 ? "No eligible employee available" : "Only %d of %d positions filled".formatted(have, need),
                    GAP_ACTIONS));
        }
        double percentage = required == 0 ? 100.0 : Math.round(staffed * 1000.0 / required) / 10.0;
        RiskLevel risk = RiskLevel.forCoverage(percentage);
        if (criticalGap && risk.compareTo(RiskLevel.HIGH) < 0) {
            risk = RiskLevel.HIGH;
        }
        return new CoverageStatus(demands.size(), fullyCovered, required, staffed, percentage, gaps, risk);
    }

    static String shiftTime(ShiftTemplate template) {
        return template.getStartTime() + "-" + template.getEndTime();
    }
}
