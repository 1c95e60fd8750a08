package org.jstats.forecast_api.modules.ensemble.service;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.forecast_api.modules.consensus.model.AlgorithmWeight;
import org.jstats.forecast_api.modules.consensus.model.ConsensusResult;
import org.jstats.forecast_api.modules.ensemble.model.BoostingState;
import org.jstats.forecast_api.modules.ensemble.model.EnsembleConfig;
import org.jstats.forecast_api.modules.ensemble.model.EnsembleResult;
import org.jstats.forecast_api.modules.ensemble.model.LayerContributions;
import org.jstats.forecast_api.modules.ensemble.model.SequentialPattern;
import org.jstats.forecast_api.modules.prediction.model.MatchInput;
import org.jstats.forecast_api.modules.prediction.model.PredictionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.jstats.forecast_api.modules.prediction.service.WagerMath.round;

/**
 * Stacks four corrections on top of a consensus: residual boosting, recent-form
 * patterns of both sides, predictor diversity and a pull toward a 55 center.
 */
@Service
@NullMarked
public class EnsembleStacker {

    private static final Logger log = LoggerFactory.getLogger(EnsembleStacker.class);

    public static final String ENSEMBLE_ID = "ensemble";
    public static final String ENSEMBLE_NAME = "Advanced Ensemble";

    private static final double BOOST_DAMPING = 0.5;
    private static final double PATTERN_SCALE = 0.4;
    private static final double CALIBRATION_CENTER = 55;

    private final SequentialPatternDetector patternDetector;
    private final DiversityScorer diversityScorer;
    private final EnsembleConfig defaultConfig;

    public EnsembleStacker(SequentialPatternDetector patternDetector, DiversityScorer diversityScorer,
                           EnsembleConfig defaultConfig) {
        this.patternDetector = patternDetector;
        this.diversityScorer = diversityScorer;
        this.defaultConfig = defaultConfig;
    }

    public EnsembleResult runAdvancedEnsemble(ConsensusResult consensus, MatchInput match) {
        return runAdvancedEnsemble(consensus, match, null);
    }

    public EnsembleResult runAdvancedEnsemble(ConsensusResult consensus, MatchInput match, @Nullable EnsembleConfig config) {
        EnsembleConfig cfg = config != null ? config : defaultConfig;
        List<PredictionResult> predictions = consensus.predictions();

        BoostingState boosting = boost(predictions, consensus.weights(), cfg);
        SequentialPattern homePattern = patternDetector.detect(match.homeTeam().recentForm(), cfg.sequentialDecay());
        SequentialPattern awayPattern = patternDetector.detect(match.awayTeam().recentForm(), cfg.sequentialDecay());
        double diversity = diversityScorer.score(predictions);

        EnsembleResult result = stack(consensus, boosting, homePattern, awayPattern, diversity, cfg);
        if (log.isDebugEnabled()) {
            log.debug("Ensemble for match {}: consensus {} -> stacked {} (pattern {}, diversity {})",
                    consensus.matchId(), consensus.confidence(), result.stackedConfidence(),
                    result.sequentialPattern().type().code(), result.diversityScore());
        }
        return result;
    }

    /**
     * Each predictor moves toward the weighted mean confidence by {@code learningRate}
     * of its remaining residual per round.
     */
    static BoostingState boost(List<PredictionResult> predictions, List<AlgorithmWeight> weights, EnsembleConfig config) {
        Map<String, Double> weightById = new HashMap<>();
        for (AlgorithmWeight w : weights) {
            weightById.put(w.algorithmId(), w.weight());
        }
        double defaultWeight = predictions.isEmpty() ? 0 : 1.0 / predictions.size();

        double target = 0;
        double totalWeight = 0;
        for (PredictionResult p : predictions) {
            double w = weightById.getOrDefault(p.algorithmId(), defaultWeight);
            target += p.confidence() * w;
            totalWeight += w;
        }
        if (totalWeight > 0) {
            target /= totalWeight;
        }

        Map<String, Double> residuals = new LinkedHashMap<>();
        Map<String, Double> adjustments = new LinkedHashMap<>();
        for (PredictionResult p : predictions) {
            residuals.put(p.algorithmId(), target - p.confidence());
            adjustments.put(p.algorithmId(), 0.0);
        }
        for (int round = 0; round < config.boostingRounds(); round++) {
            for (Map.Entry<String, Double> residual : residuals.entrySet()) {
                adjustments.merge(residual.getKey(), residual.getValue() * config.learningRate(), Double::sum);
                residual.setValue(residual.getValue() * (1 - config.learningRate()));
            }
        }
        return new BoostingState(residuals, adjustments, config.boostingRounds());
    }

    static EnsembleResult stack(ConsensusResult consensus, BoostingState boosting,
                                SequentialPattern homePattern, SequentialPattern awayPattern,
                                double diversityScore, EnsembleConfig config) {
        double stacked = consensus.weightedConfidence();

        double boostContribution = boosting.meanAdjustment() * BOOST_DAMPING;
        stacked += boostContribution;

        double patternImpact = (homePattern.adjustment() - awayPattern.adjustment()) * PATTERN_SCALE;
        stacked += patternImpact;
        SequentialPattern primary = Math.abs(homePattern.strength()) >= Math.abs(awayPattern.strength())
                ? homePattern
                : awayPattern;

        double diversityBonus = diversityScore * config.diversityWeight() * 10;
        stacked += diversityBonus;

        double calibrationDelta = (CALIBRATION_CENTER - stacked) * config.calibrationStrength() * 0.1;
        stacked += calibrationDelta;

        double finalConfidence = Math.max(40, Math.min(95, Math.round(stacked)));

        Map<String, Double> roundedAdjustments = new LinkedHashMap<>();
        boosting.adjustments().forEach((id, adj) -> roundedAdjustments.put(id, round(adj, 2)));

        var prediction = consensus.prediction()
                .withAlgorithm(ENSEMBLE_ID, ENSEMBLE_NAME)
                .withConfidence(finalConfidence);

        return new EnsembleResult(
                consensus.withPrediction(prediction),
                roundedAdjustments,
                primary,
                round(diversityScore, 2),
                round(calibrationDelta, 2),
                new LayerContributions(
                        round(consensus.weightedConfidence(), 2),
                        round(boostContribution, 2),
                        round(patternImpact, 2),
                        round(diversityBonus, 2)),
                finalConfidence);
    }
}
