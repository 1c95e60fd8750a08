package org.jstats.forecast_api.modules.prediction.model;

import java.time.Instant;

/**
 * Output of one algorithm for one match.
 *
 * @param confidence      0-100, clamped to the algorithm's range before consensus
 * @param trueProbability confidence / 100 as computed before any result hook
 * @param impliedOdds     fair decimal price, {@code 1 / trueProbability}
 * @param kellyFraction   fractional Kelly stake as a share of bankroll, never negative
 * @param kellyStakeUnits stake on a 100 unit bankroll
 */
public record PredictionResult(
        String matchId,
        String algorithmId,
        String algorithmName,
        Recommendation recommendation,
        double confidence,
        double trueProbability,
        ScorePair projectedScore,
        double impliedOdds,
        double expectedValue,
        double evPercentage,
        double kellyFraction,
        double kellyStakeUnits,
        PredictionFactors factors,
        Instant generatedAt
) {
    public PredictionResult withConfidence(double newConfidence) {
        return new PredictionResult(matchId, algorithmId, algorithmName, recommendation, newConfidence,
                trueProbability, projectedScore, impliedOdds, expectedValue, evPercentage,
                kellyFraction, kellyStakeUnits, factors, generatedAt);
    }

    public PredictionResult withAlgorithm(String newAlgorithmId, String newAlgorithmName) {
        return new PredictionResult(matchId, newAlgorithmId, newAlgorithmName, recommendation, confidence,
                trueProbability, projectedScore, impliedOdds, expectedValue, evPercentage,
                kellyFraction, kellyStakeUnits, factors, generatedAt);
    }
}
