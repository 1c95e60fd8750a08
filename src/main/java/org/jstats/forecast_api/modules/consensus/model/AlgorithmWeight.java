package org.jstats.forecast_api.modules.consensus.model;

/**
 * Trust placed in one algorithm. Weights of a cohort sum to 1.
 *
 * @param reliability how much the weight itself can be trusted, from sample size; 0 for defaults
 */
public record AlgorithmWeight(
        String algorithmId,
        String algorithmName,
        double weight,
        double winRate,
        int totalPredictions,
        double avgConfidence,
        double reliability
) {}
