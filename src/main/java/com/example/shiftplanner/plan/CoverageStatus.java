package com.example.shiftplanner.plan;

import java.util.List;

public record CoverageStatus(
        int totalDemands,
        int filledDemands,
        int requiredPositions,
        int filledPositions,
        double coveragePercentage,
        List<CoverageGap> gaps,
        RiskLevel riskLevel
) {}
