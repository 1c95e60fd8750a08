package org.jstats.forecast_api.modules.prediction.model;

import java.time.Instant;

/**
 * A persisted prediction row, as read back for settlement and calibration.
 *
 * @param accuracyRating 0-100 once settled, null while pending
 */
public record StoredPrediction(
        long id,
        String matchId,
        String algorithmId,
        Recommendation recommendation,
        double confidence,
        ScorePair projectedScore,
        PredictionStatus status,
        Integer accuracyRating,
        Instant generatedAt,
        Instant settledAt
) {
    public boolean won() {
        return status == PredictionStatus.WON;
    }
}
