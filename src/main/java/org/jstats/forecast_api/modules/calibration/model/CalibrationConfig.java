package org.jstats.forecast_api.modules.calibration.model;

import java.util.Map;

/**
 * Tuning of the calibration controller, passed explicitly to every run.
 *
 * @param minBets                  decided bets required before anything is adjusted
 * @param maxConfidenceReduction   percentage points, e.g. 15 for at most -15%
 * @param maxConfidenceBoost       percentage points
 * @param minConfidenceFloor       lowest minimum-confidence threshold an algorithm can earn
 * @param baseWeights              starting weight per algorithm id
 * @param defaultBaseWeight        starting weight for ids missing from {@code baseWeights}
 */
public record CalibrationConfig(
        int minBets,
        double underperformanceThreshold,
        double overperformanceThreshold,
        double maxWeightChange,
        double maxConfidenceReduction,
        double maxConfidenceBoost,
        double minConfidenceFloor,
        int coldStreakThreshold,
        int hotStreakThreshold,
        int windowDays,
        Map<String, Double> baseWeights,
        double defaultBaseWeight
) {
    public CalibrationConfig {
        baseWeights = baseWeights == null ? Map.of() : Map.copyOf(baseWeights);
    }

    public static CalibrationConfig defaults(Map<String, Double> baseWeights) {
        return new CalibrationConfig(10, 10, 10, 0.15, 15, 10, 45, 5, 5, 30, baseWeights, 0.33);
    }

    public double baseWeightFor(String algorithmId) {
        return baseWeights.getOrDefault(algorithmId, defaultBaseWeight);
    }
}
