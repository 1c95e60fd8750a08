package org.jstats.forecast_api.modules.montecarlo.model;

/**
 * Simulation settings.
 *
 * @param numSamples        trials to run; all of them always complete
 * @param confidenceNoise   std-dev of the confidence perturbation, in points
 * @param scoreNoise        std-dev of each projected score perturbation
 * @param probabilityNoise  std-dev of the true probability perturbation
 * @param lowerPercentile   lower band percentile, 0-100
 * @param upperPercentile   upper band percentile, 0-100
 * @param seed              fixes the random source when set
 */
public record MonteCarloConfig(
        int numSamples,
        double confidenceNoise,
        double scoreNoise,
        double probabilityNoise,
        double lowerPercentile,
        double upperPercentile,
        Long seed
) {
    public static final MonteCarloConfig DEFAULT = new MonteCarloConfig(200, 6, 4, 0.08, 10, 90, null);

    public MonteCarloConfig withSeed(Long newSeed) {
        return new MonteCarloConfig(numSamples, confidenceNoise, scoreNoise, probabilityNoise,
                lowerPercentile, upperPercentile, newSeed);
    }

    public MonteCarloConfig withNumSamples(int samples) {
        return new MonteCarloConfig(samples, confidenceNoise, scoreNoise, probabilityNoise,
                lowerPercentile, upperPercentile, seed);
    }
}
