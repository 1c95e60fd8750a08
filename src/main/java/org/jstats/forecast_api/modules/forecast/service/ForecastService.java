package org.jstats.forecast_api.modules.forecast.service;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.forecast_api.modules.calibration.model.BinCalibrationResult;
import org.jstats.forecast_api.modules.calibration.model.ModelWeight;
import org.jstats.forecast_api.modules.calibration.model.WeightAdjustment;
import org.jstats.forecast_api.modules.calibration.repository.BinCalibrationRepository;
import org.jstats.forecast_api.modules.calibration.repository.ModelWeightRepository;
import org.jstats.forecast_api.modules.calibration.service.ModelCalibrationService;
import org.jstats.forecast_api.modules.consensus.model.AlgorithmWeight;
import org.jstats.forecast_api.modules.consensus.model.ConsensusResult;
import org.jstats.forecast_api.modules.consensus.service.ConsensusSynthesizer;
import org.jstats.forecast_api.modules.consensus.service.WeightEngine;
import org.jstats.forecast_api.modules.ensemble.model.EnsembleResult;
import org.jstats.forecast_api.modules.ensemble.service.EnsembleStacker;
import org.jstats.forecast_api.modules.forecast.model.ForecastResponse;
import org.jstats.forecast_api.modules.montecarlo.model.MonteCarloConfig;
import org.jstats.forecast_api.modules.montecarlo.model.MonteCarloResult;
import org.jstats.forecast_api.modules.montecarlo.service.MonteCarloSimulator;
import org.jstats.forecast_api.modules.prediction.model.FinalScore;
import org.jstats.forecast_api.modules.prediction.model.MatchInput;
import org.jstats.forecast_api.modules.prediction.model.PredictionContext;
import org.jstats.forecast_api.modules.prediction.model.PredictionResult;
import org.jstats.forecast_api.modules.prediction.model.StoredPrediction;
import org.jstats.forecast_api.modules.prediction.service.PredictionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for callers: predictions, consensus, ensemble and optional Monte Carlo
 * for a match, plus result settlement that feeds the calibration job.
 */
@Service
@NullMarked
public class ForecastService {

    private static final Logger log = LoggerFactory.getLogger(ForecastService.class);

    private final PredictionService predictionService;
    private final WeightEngine weightEngine;
    private final ConsensusSynthesizer consensusSynthesizer;
    private final EnsembleStacker ensembleStacker;
    private final MonteCarloSimulator monteCarloSimulator;
    private final MonteCarloConfig monteCarloConfig;
    private final ModelCalibrationService calibrationService;
    private final ModelWeightRepository modelWeightRepository;
    private final BinCalibrationRepository binCalibrationRepository;

    public ForecastService(
            PredictionService predictionService,
            WeightEngine weightEngine,
            ConsensusSynthesizer consensusSynthesizer,
            EnsembleStacker ensembleStacker,
            MonteCarloSimulator monteCarloSimulator,
            MonteCarloConfig monteCarloConfig,
            ModelCalibrationService calibrationService,
            ModelWeightRepository modelWeightRepository,
            BinCalibrationRepository binCalibrationRepository) {
        this.predictionService = predictionService;
        this.weightEngine = weightEngine;
        this.consensusSynthesizer = consensusSynthesizer;
        this.ensembleStacker = ensembleStacker;
        this.monteCarloSimulator = monteCarloSimulator;
        this.monteCarloConfig = monteCarloConfig;
        this.calibrationService = calibrationService;
        this.modelWeightRepository = modelWeightRepository;
        this.binCalibrationRepository = binCalibrationRepository;
    }

    public List<PredictionResult> predict(MatchInput match, @Nullable PredictionContext context) {
        return predictionService.predictAll(match, context);
    }

    public List<PredictionResult> predictBatch(List<MatchInput> matches, @Nullable PredictionContext context) {
        return predictionService.predictBatch(matches, context);
    }

    public List<AlgorithmWeight> weights() {
        return weightEngine.fetchWeights();
    }

    public ForecastResponse forecast(MatchInput match, @Nullable PredictionContext context,
                                     boolean simulate, @Nullable Long seed) {
        List<PredictionResult> predictions = predictionService.predictAll(match, context);
        List<AlgorithmWeight> weights = weightEngine.fetchWeights();

        ConsensusResult consensus = consensusSynthesizer.synthesize(predictions, weights, match.id());
        EnsembleResult ensemble = ensembleStacker.runAdvancedEnsemble(consensus, match);

        MonteCarloResult monteCarlo = null;
        if (simulate) {
            MonteCarloConfig config = seed != null ? monteCarloConfig.withSeed(seed) : monteCarloConfig;
            monteCarlo = monteCarloSimulator.fromEnsemble(ensemble, config);
        }

        List<ModelWeight> modelWeights = latestModelWeights();
        BinCalibrationResult bins = latestBins();
        Map<String, WeightAdjustment> adjustments = new LinkedHashMap<>();
        for (PredictionResult p : predictions) {
            adjustments.put(p.algorithmId(),
                    calibrationService.applyWeightAdjustment(p.confidence(), p.algorithmId(), modelWeights, bins));
        }

        if (log.isInfoEnabled()) {
            log.info("Forecast {}: consensus {} @ {} (agreement {}), ensemble {}",
                    match.id(), consensus.recommendation().code(), consensus.confidence(),
                    consensus.agreement(), ensemble.stackedConfidence());
        }
        return new ForecastResponse(match.id(), predictions, weights, consensus, ensemble, monteCarlo, adjustments);
    }

    public List<StoredPrediction> recordResult(String matchId, FinalScore score) {
        return predictionService.settle(matchId, score);
    }

    private List<ModelWeight> latestModelWeights() {
        try {
            return modelWeightRepository.findLatest();
        } catch (DataAccessException e) {
            if (log.isWarnEnabled()) {
                log.warn("Model weights unavailable, using uncalibrated thresholds: {}", e.getMessage());
            }
            return List.of();
        }
    }

    private @Nullable BinCalibrationResult latestBins() {
        try {
            return binCalibrationRepository.findLatest().orElse(null);
        } catch (DataAccessException e) {
            if (log.isWarnEnabled()) {
                log.warn("Bin calibration unavailable, skipping confidence bins: {}", e.getMessage());
            }
            return null;
        }
    }
}
