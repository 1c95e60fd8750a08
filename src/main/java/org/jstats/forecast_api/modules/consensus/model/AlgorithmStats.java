package org.jstats.forecast_api.modules.consensus.model;

/**
 * Stored performance aggregate for one algorithm. Null columns read as defaults.
 */
public record AlgorithmStats(
        String algorithmId,
        Double winRate,
        Integer totalPredictions,
        Integer correctPredictions,
        Double avgConfidence
) {
    public double winRateOrDefault() {
        return winRate != null ? winRate : 50;
    }

    public int totalPredictionsOrDefault() {
        return totalPredictions != null ? totalPredictions : 0;
    }

    public double avgConfidenceOrDefault() {
        return avgConfidence != null ? avgConfidence : 50;
    }
}
