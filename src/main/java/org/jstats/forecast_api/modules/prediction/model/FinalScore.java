package org.jstats.forecast_api.modules.prediction.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Final result of a finished match.
 */
public record FinalScore(
        @NotBlank String homeTeamId,
        @NotBlank String awayTeamId,
        String league,
        @Min(0) int homeScore,
        @Min(0) int awayScore
) {
    public Recommendation outcome() {
        if (homeScore > awayScore) {
            return Recommendation.HOME;
        }
        return homeScore < awayScore ? Recommendation.AWAY : Recommendation.DRAW;
    }
}
