package org.jstats.forecast_api.modules.prediction.model;

/**
 * Inputs behind a single prediction, kept for transparency.
 * {@code teamStrength.differential} is always {@code home.overall - away.overall}.
 */
public record PredictionFactors(
        TeamStrength teamStrength,
        double homeAdvantage,
        Momentum momentum,
        HistoricalFactor historical,
        InjuryFactor injuries,
        WeatherFactor weather
) {
    public record TeamStrength(StrengthMetrics home, StrengthMetrics away, double differential) {
        public static TeamStrength of(StrengthMetrics home, StrengthMetrics away) {
            return new TeamStrength(home, away, home.overall() - away.overall());
        }
    }

    public record Momentum(double home, double away, double differential) {}

    public record HistoricalFactor(HistoricalMatchup data, double impact) {}

    public record InjuryFactor(double homeImpact, double awayImpact, double differential) {}

    public record WeatherFactor(String condition, double impact) {}

    public static PredictionFactors neutral() {
        StrengthMetrics neutral = StrengthMetrics.neutral();
        return new PredictionFactors(TeamStrength.of(neutral, neutral), 2.0,
                new Momentum(50, 50, 0), null, null, null);
    }

    public PredictionFactors withHistorical(HistoricalFactor factor) {
        return new PredictionFactors(teamStrength, homeAdvantage, momentum, factor, injuries, weather);
    }
}
