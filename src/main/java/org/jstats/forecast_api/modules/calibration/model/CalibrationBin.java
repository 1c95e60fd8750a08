package org.jstats.forecast_api.modules.calibration.model;

/**
 * Realized versus stated win rate within one 5-point confidence range.
 *
 * @param expectedWinRate  midpoint of the range
 * @param calibrationError {@code actualWinRate - expectedWinRate}, 1 decimal
 * @param adjustmentFactor multiplier for confidences in this range, 2 decimals
 */
public record CalibrationBin(
        int minConfidence,
        int maxConfidence,
        String label,
        double actualWinRate,
        double expectedWinRate,
        double calibrationError,
        int sampleSize,
        double adjustmentFactor,
        boolean overconfident,
        boolean underconfident
) {}
