package org.jstats.forecast_api.modules.prediction.model;

/**
 * Immutable tuning of one predictor.
 */
public record AlgorithmConfig(
        String id,
        String name,
        String description,
        String version,
        Weights weights,
        Thresholds thresholds
) {
    public record Weights(
            double teamStrength,
            double homeAdvantage,
            double momentum,
            double historical,
            double injuries,
            double weather
    ) {
        public static final Weights DEFAULT = new Weights(0.30, 0.15, 0.20, 0.15, 0.10, 0.10);
    }

    /**
     * @param minConfidence      floor of the confidence range
     * @param skipThreshold      below this the recommendation is {@code skip}
     * @param highValueThreshold confidence at which a pick is flagged high value
     */
    public record Thresholds(double minConfidence, double skipThreshold, double highValueThreshold) {
        public static final Thresholds DEFAULT = new Thresholds(40, 45, 65);
    }

    public static AlgorithmConfig defaults(String id, String name) {
        return new AlgorithmConfig(id, name, "", "1.0.0", Weights.DEFAULT, Thresholds.DEFAULT);
    }
}
