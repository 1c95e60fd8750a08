package org.jstats.forecast_api.modules.prediction.model;

/**
 * Head-to-head aggregate between the two sides, from the home team's perspective.
 */
public record HistoricalMatchup(
        int homeWins,
        int awayWins,
        int draws,
        int totalGames,
        Double avgHomeScore,
        Double avgAwayScore
) {
    public static HistoricalMatchup empty() {
        return new HistoricalMatchup(0, 0, 0, 0, null, null);
    }

    public double homeWinPct() {
        return totalGames > 0 ? (double) homeWins / totalGames : 0.5;
    }
}
