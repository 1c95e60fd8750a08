package org.jstats.forecast_api.modules.prediction.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * A fixture to forecast.
 *
 * @param id       match identifier used to key predictions
 * @param homeTeam home side
 * @param awayTeam away side
 * @param league   league code (NBA, NFL, EPL, ...), drives home advantage and base scores
 * @param kickoff  scheduled start
 * @param status   lifecycle status
 * @param score    current score, only meaningful once live
 * @param odds     market prices, optional
 */
public record MatchInput(
        @NotBlank String id,
        @NotNull @Valid TeamSnapshot homeTeam,
        @NotNull @Valid TeamSnapshot awayTeam,
        @NotBlank String league,
        Instant kickoff,
        MatchStatus status,
        Score score,
        OddsSnapshot odds
) {
    public MatchInput {
        if (status == null) {
            status = MatchStatus.SCHEDULED;
        }
    }

    public record Score(int home, int away, String period) {}
}
