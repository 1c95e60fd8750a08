package org.jstats.forecast_api.modules.prediction.service;

import org.jstats.forecast_api.modules.prediction.model.FinalScore;
import org.jstats.forecast_api.modules.prediction.model.PredictionStatus;
import org.jstats.forecast_api.modules.prediction.model.StoredPrediction;
import org.springframework.stereotype.Component;

/**
 * Settles a stored prediction against the final score.
 */
@Component
public class PredictionGrader {

    public record Grade(PredictionStatus status, Integer accuracyRating) {}

    public Grade grade(StoredPrediction prediction, FinalScore score) {
        if (!prediction.recommendation().isSide()) {
            return new Grade(PredictionStatus.VOID, null);
        }
        boolean correct = prediction.recommendation() == score.outcome();
        return new Grade(correct ? PredictionStatus.WON : PredictionStatus.LOST,
                accuracyRating(prediction, score, correct));
    }

    /**
     * 50 for the right winner, up to 25 for the margin and up to 25 for the per-side score error.
     */
    static int accuracyRating(StoredPrediction prediction, FinalScore score, boolean correctWinner) {
        double projectedHome = prediction.projectedScore().home();
        double projectedAway = prediction.projectedScore().away();

        double rating = correctWinner ? 50 : 0;
        double marginError = Math.abs((projectedHome - projectedAway) - (score.homeScore() - score.awayScore()));
        rating += Math.max(0, 25 - marginError * 3);
        double avgScoreError = (Math.abs(projectedHome - score.homeScore()) + Math.abs(projectedAway - score.awayScore())) / 2;
        rating += Math.max(0, 25 - avgScoreError * 2);
        return (int) Math.round(rating);
    }
}
