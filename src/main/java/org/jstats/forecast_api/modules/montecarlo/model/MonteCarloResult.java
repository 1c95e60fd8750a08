package org.jstats.forecast_api.modules.montecarlo.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param pickStability    share of samples that produced the most frequent pick
 * @param pickDistribution share of samples per pick code (home, away, skip); sums to 1 unless empty
 */
public record MonteCarloResult(
        UncertaintyBand confidence,
        UncertaintyBand trueProbability,
        UncertaintyBand projectedScoreHome,
        UncertaintyBand projectedScoreAway,
        UncertaintyBand evPercentage,
        double pickStability,
        Map<String, Double> pickDistribution,
        CalibrationSignal calibrationSignal,
        int numSamples
) {
    public MonteCarloResult {
        pickDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(pickDistribution));
    }

    public static MonteCarloResult empty(int numSamples) {
        return new MonteCarloResult(UncertaintyBand.EMPTY, UncertaintyBand.EMPTY, UncertaintyBand.EMPTY,
                UncertaintyBand.EMPTY, UncertaintyBand.EMPTY, 0, Map.of(), CalibrationSignal.UNCERTAIN, numSamples);
    }
}
