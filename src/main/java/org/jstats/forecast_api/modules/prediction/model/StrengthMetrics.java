package org.jstats.forecast_api.modules.prediction.model;

/**
 * Derived team strength. Recomputed on every prediction, never stored on its own.
 */
public record StrengthMetrics(double offense, double defense, double momentum, double overall) {

    public static StrengthMetrics of(double offense, double defense, double momentum) {
        return new StrengthMetrics(offense, defense, momentum, (offense + defense + momentum) / 3);
    }

    public static StrengthMetrics neutral() {
        return of(50, 50, 50);
    }
}
