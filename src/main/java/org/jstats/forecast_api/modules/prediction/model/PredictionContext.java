package org.jstats.forecast_api.modules.prediction.model;

/**
 * Optional extra inputs for a prediction. Every component may be null.
 *
 * @param historical head-to-head aggregate
 * @param injuries   injury impact per side on a 0-10 scale
 * @param weather    weather condition and its estimated impact
 * @param odds       prices that override the ones carried by the match
 */
public record PredictionContext(
        HistoricalMatchup historical,
        Injuries injuries,
        Weather weather,
        OddsSnapshot odds
) {
    public record Injuries(double homeImpact, double awayImpact) {}

    public record Weather(String condition, double temperature, double wind, double impact) {}

    public static PredictionContext empty() {
        return new PredictionContext(null, null, null, null);
    }

    public PredictionContext withHistorical(HistoricalMatchup matchup) {
        return new PredictionContext(matchup, injuries, weather, odds);
    }
}
