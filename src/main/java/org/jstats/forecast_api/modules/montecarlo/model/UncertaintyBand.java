package org.jstats.forecast_api.modules.montecarlo.model;

/**
 * Spread of one simulated metric. Values are rounded to 2 decimals.
 *
 * @param point    sample mean
 * @param widthPct {@code upper - lower} as a percentage of {@code |point|}, 0 when the point is 0
 */
public record UncertaintyBand(double point, double lower, double upper, double stdDev, double widthPct) {

    public static final UncertaintyBand EMPTY = new UncertaintyBand(0, 0, 0, 0, 0);

    public double width() {
        return upper - lower;
    }
}
