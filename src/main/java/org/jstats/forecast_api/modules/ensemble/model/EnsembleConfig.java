package org.jstats.forecast_api.modules.ensemble.model;

/**
 * Tuning of the stacked ensemble.
 *
 * @param learningRate        step size of the boosting layer, in (0,1)
 * @param boostingRounds      boosting iterations
 * @param sequentialDecay     damping applied to streak adjustments
 * @param diversityWeight     scale of the diversity bonus
 * @param calibrationStrength pull toward the 55 center
 */
public record EnsembleConfig(
        double learningRate,
        int boostingRounds,
        double sequentialDecay,
        double diversityWeight,
        double calibrationStrength
) {
    public static final EnsembleConfig DEFAULT = new EnsembleConfig(0.15, 5, 0.9, 0.12, 0.3);
}
