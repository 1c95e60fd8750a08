package org.jstats.forecast_api.modules.consensus.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import org.jstats.forecast_api.modules.prediction.model.PredictionResult;
import org.jstats.forecast_api.modules.prediction.model.Recommendation;

import java.util.List;

/**
 * Weighted fusion of several predictions. The fused values live in {@code prediction}
 * and serialize inline next to the consensus-only fields.
 *
 * @param agreement          share of predictors backing the winning recommendation
 * @param weightedConfidence weighted mean confidence before the agreement penalty
 */
public record ConsensusResult(
        @JsonUnwrapped PredictionResult prediction,
        List<PredictionResult> predictions,
        List<AlgorithmWeight> weights,
        double agreement,
        boolean unanimous,
        double weightedConfidence
) {
    public ConsensusResult {
        predictions = List.copyOf(predictions);
        weights = List.copyOf(weights);
    }

    public ConsensusResult withPrediction(PredictionResult replacement) {
        return new ConsensusResult(replacement, predictions, weights, agreement, unanimous, weightedConfidence);
    }

    public String matchId() {
        return prediction.matchId();
    }

    public Recommendation recommendation() {
        return prediction.recommendation();
    }

    public double confidence() {
        return prediction.confidence();
    }
}
