package com.example.shiftplanner.sync;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record SyncRequest(@NotNull(message = "changes is required") List<@Valid PlanningChange> changes) {
}
