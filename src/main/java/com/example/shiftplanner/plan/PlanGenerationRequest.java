package com.example.shiftplanner.plan;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.util.List;

public record PlanGenerationRequest(
        @NotNull(message = "Date range is required") @Valid DateRange dateRange,
        List<String> stationIds,
        List<String> shiftTemplateIds,
        String strategy,
        @Valid List<CustomConstraint> constraints
) {
    public record DateRange(
            @NotNull(message = "Start date is required") LocalDate start,
            @NotNull(message = "End date is required") LocalDate end
    ) {}
}
