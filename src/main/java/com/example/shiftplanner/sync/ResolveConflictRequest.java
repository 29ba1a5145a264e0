package com.example.shiftplanner.sync;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record ResolveConflictRequest(
        @NotNull(message = "resolution is required") @Valid ConflictResolution resolution,
        String userId,
        String sessionId
) {}
