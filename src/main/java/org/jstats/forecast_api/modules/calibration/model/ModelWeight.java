package org.jstats.forecast_api.modules.calibration.model;

import java.time.Instant;

/**
 * Calibrated trust in one algorithm. {@code adjustedWeight} is normalized across the cohort.
 */
public record ModelWeight(
        String algorithmId,
        String algorithmName,
        double baseWeight,
        double adjustedWeight,
        String adjustmentReason,
        double confidenceMultiplier,
        double minConfidenceThreshold,
        Instant lastUpdated
) {
    public ModelWeight withAdjustedWeight(double weight) {
        return new ModelWeight(algorithmId, algorithmName, baseWeight, weight, adjustmentReason,
                confidenceMultiplier, minConfidenceThreshold, lastUpdated);
    }
}
