package com.example.shiftplanner.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class PlanningSettings {
    private final int maxRangeDays;
    private final String defaultUser;
    private final Duration inactivityTimeout;

    public PlanningSettings(
            @Value("${planning.generation.max-range-days:62}") int maxRangeDays,
            @Value("${planning.sync.default-user:system}") String defaultUser,
            @Value("${planning.realtime.inactivity-timeout-ms:300000}") long inactivityTimeoutMs) {
        this.maxRangeDays = maxRangeDays;
        this.defaultUser = defaultUser;
        this.inactivityTimeout = Duration.ofMillis(inactivityTimeoutMs);
    }

    public int getMaxRangeDays() { return maxRangeDays; }
    public String getDefaultUser() { return defaultUser; }
    public Duration getInactivityTimeout() { return inactivityTimeout; }
}
