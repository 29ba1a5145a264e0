package com.example.shiftplanner.plan;

import com.example.shiftplanner.station.Priority;

import java.time.LocalDate;
import java.util.List;

public record CoverageGap(
        String demandId,
        String stationId,
        String stationName,
        LocalDate date,
        String shiftTime,
        Priority criticality,
        int required,
        int filled,
        String reason,
        List<String> suggestedActions
) {}
