package org.jstats.forecast_api.modules.ensemble.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import org.jstats.forecast_api.modules.consensus.model.ConsensusResult;
import org.jstats.forecast_api.modules.prediction.model.Recommendation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A consensus refined by the stacked ensemble. {@code consensus.prediction()} carries
 * the ensemble identity and the stacked confidence; everything else is the consensus'.
 */
public record EnsembleResult(
        @JsonUnwrapped ConsensusResult consensus,
        Map<String, Double> boostingAdjustments,
        SequentialPattern sequentialPattern,
        double diversityScore,
        double calibrationDelta,
        LayerContributions layerContributions,
        double stackedConfidence
) {
    public EnsembleResult {
        boostingAdjustments = Collections.unmodifiableMap(new LinkedHashMap<>(boostingAdjustments));
    }

    public String matchId() {
        return consensus.matchId();
    }

    public Recommendation recommendation() {
        return consensus.recommendation();
    }

    public double confidence() {
        return consensus.confidence();
    }
}
