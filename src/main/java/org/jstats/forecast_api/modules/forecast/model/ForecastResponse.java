package org.jstats.forecast_api.modules.forecast.model;

import org.jstats.forecast_api.modules.calibration.model.WeightAdjustment;
import org.jstats.forecast_api.modules.consensus.model.AlgorithmWeight;
import org.jstats.forecast_api.modules.consensus.model.ConsensusResult;
import org.jstats.forecast_api.modules.ensemble.model.EnsembleResult;
import org.jstats.forecast_api.modules.montecarlo.model.MonteCarloResult;
import org.jstats.forecast_api.modules.prediction.model.PredictionResult;

import java.util.List;
import java.util.Map;

/**
 * Full pipeline output for one match.
 *
 * @param monteCarlo  null unless a simulation was requested
 * @param adjustments calibrated verdict per algorithm id
 */
public record ForecastResponse(
        String matchId,
        List<PredictionResult> predictions,
        List<AlgorithmWeight> weights,
        ConsensusResult consensus,
        EnsembleResult ensemble,
        MonteCarloResult monteCarlo,
        Map<String, WeightAdjustment> adjustments
) {}
