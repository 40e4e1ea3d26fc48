package com.example.shifthybrid.validation;

import java.util.Map;

/**
 * Quality figures of a schedule. {@code preferredShiftHonorRate} is 1.0 when no
 * preferred-shift rule applies anywhere.
 */
public record FairnessMetrics(
        Map<String, Integer> offDaysByStaff,
        double offDayVariance,
        double preferredShiftHonorRate,
        long weightedViolationScore,
        int tierOneViolations,
        int tierTwoViolations,
        int tierThreeViolations
) {
    public FairnessMetrics {
        offDaysByStaff = offDaysByStaff == null ? Map.of() : offDaysByStaff;
    }
}
