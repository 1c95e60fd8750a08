package org.jstats.forecast_api.modules.montecarlo.service;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.forecast_api.modules.consensus.model.AlgorithmWeight;
import org.jstats.forecast_api.modules.consensus.model.ConsensusResult;
import org.jstats.forecast_api.modules.ensemble.model.EnsembleResult;
import org.jstats.forecast_api.modules.montecarlo.model.CalibrationSignal;
import org.jstats.forecast_api.modules.montecarlo.model.MonteCarloConfig;
import org.jstats.forecast_api.modules.montecarlo.model.MonteCarloResult;
import org.jstats.forecast_api.modules.montecarlo.model.UncertaintyBand;
import org.jstats.forecast_api.modules.prediction.model.PredictionResult;
import org.jstats.forecast_api.modules.prediction.model.Recommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.jstats.forecast_api.modules.prediction.service.WagerMath.round;

/**
 * Quantifies how much a consensus depends on the exact numbers its predictors produced.
 * <p>
 * Every sample perturbs each predictor's confidence, probability, scores and EV with
 * Gaussian noise, re-weights them like the deterministic consensus and records the pick.
 * The simulator holds no random state; each run builds its own source from the config seed.
 */
@Service
@NullMarked
public class MonteCarloSimulator {

    private static final Logger log = LoggerFactory.getLogger(MonteCarloSimulator.class);

    private static final double VOTE_SKIP_BELOW = 45;
    private static final double WIDE_BAND = 20;
    private static final double EDGE_MARGIN = 3;

    private final MonteCarloConfig defaultConfig;

    public MonteCarloSimulator(MonteCarloConfig defaultConfig) {
        this.defaultConfig = defaultConfig;
    }

    public MonteCarloResult run(List<PredictionResult> predictions, List<AlgorithmWeight> weights,
                                @Nullable MonteCarloConfig config) {
        MonteCarloConfig cfg = config != null ? config : defaultConfig;
        if (predictions.isEmpty() || cfg.numSamples() <= 0) {
            return MonteCarloResult.empty(Math.max(0, cfg.numSamples()));
        }

        Map<String, Double> weightById = new HashMap<>();
        for (AlgorithmWeight w : weights) {
            weightById.put(w.algorithmId(), w.weight());
        }
        double defaultWeight = 1.0 / predictions.size();
        GaussianSampler sampler = GaussianSampler.of(cfg.seed());

        int n = cfg.numSamples();
        double[] confidence = new double[n];
        double[] probability = new double[n];
        double[] homeScore = new double[n];
        double[] awayScore = new double[n];
        double[] ev = new double[n];
        int kept = 0;
        Map<Recommendation, Integer> pickCounts = new LinkedHashMap<>();

        for (int i = 0; i < n; i++) {
            double wConf = 0, wProb = 0, wHome = 0, wAway = 0, wEv = 0, wTotal = 0;
            double homeVote = 0, awayVote = 0, skipVote = 0;

            for (PredictionResult p : predictions) {
                double w = weightById.getOrDefault(p.algorithmId(), defaultWeight);
                double noisyConf = clamp(sampler.next(p.confidence(), cfg.confidenceNoise()), 30, 98);
                double noisyProb = clamp(sampler.next(p.trueProbability(), cfg.probabilityNoise()), 0.05, 0.98);
                double noisyHome = Math.max(0, sampler.next(p.projectedScore().home(), cfg.scoreNoise()));
                double noisyAway = Math.max(0, sampler.next(p.projectedScore().away(), cfg.scoreNoise()));
                double noisyEv = sampler.next(p.evPercentage(), cfg.confidenceNoise() * 0.5);

                wConf += noisyConf * w;
                wProb += noisyProb * w;
                wHome += noisyHome * w;
                wAway += noisyAway * w;
                wEv += noisyEv * w;
                wTotal += w;

                if (noisyConf < VOTE_SKIP_BELOW) {
                    skipVote += w;
                } else if (noisyHome > noisyAway) {
                    homeVote += w;
                } else {
                    awayVote += w;
                }
            }

            if (wTotal > 0) {
                confidence[kept] = wConf / wTotal;
                probability[kept] = wProb / wTotal;
                homeScore[kept] = wHome / wTotal;
                awayScore[kept] = wAway / wTotal;
                ev[kept] = wEv / wTotal;
                kept++;
            }

            Recommendation pick = skipVote > homeVote && skipVote > awayVote
                    ? Recommendation.SKIP
                    : homeVote >= awayVote ? Recommendation.HOME : Recommendation.AWAY;
            pickCounts.merge(pick, 1, Integer::sum);
        }

        double lower = cfg.lowerPercentile();
        double upper = cfg.upperPercentile();
        UncertaintyBand confidenceBand = band(Arrays.copyOf(confidence, kept), lower, upper);

        int topCount = pickCounts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        Map<String, Double> distribution = new LinkedHashMap<>();
        pickCounts.forEach((pick, count) -> distribution.put(pick.code(), (double) count / n));

        MonteCarloResult result = new MonteCarloResult(
                confidenceBand,
                band(Arrays.copyOf(probability, kept), lower, upper),
                band(Arrays.copyOf(homeScore, kept), lower, upper),
                band(Arrays.copyOf(awayScore, kept), lower, upper),
                band(Arrays.copyOf(ev, kept), lower, upper),
                n > 0 ? (double) topCount / n : 0,
                distribution,
                signal(confidenceBand),
                n);
        if (log.isDebugEnabled()) {
            log.debug("Monte Carlo over {} predictors x {} samples: confidence {} [{}, {}], stability {}, {}",
                    predictions.size(), n, confidenceBand.point(), confidenceBand.lower(), confidenceBand.upper(),
                    result.pickStability(), result.calibrationSignal().code());
        }
        return result;
    }

    public MonteCarloResult fromEnsemble(EnsembleResult ensemble, @Nullable MonteCarloConfig config) {
        return fromConsensus(ensemble.consensus(), config);
    }

    public MonteCarloResult fromConsensus(ConsensusResult consensus, @Nullable MonteCarloConfig config) {
        return run(consensus.predictions(), consensus.weights(), config);
    }

    static UncertaintyBand band(double[] samples, double lowerPercentile, double upperPercentile) {
        int n = samples.length;
        if (n == 0) {
            return UncertaintyBand.EMPTY;
        }
        double[] sorted = samples.clone();
        Arrays.sort(sorted);

        double mean = Arrays.stream(samples).average().orElse(0);
        double variance = Arrays.stream(samples).map(v -> (v - mean) * (v - mean)).sum() / n;

        int lowerIdx = Math.min(n - 1, (int) Math.floor(lowerPercentile / 100 * n));
        int upperIdx = Math.min(n - 1, (int) Math.floor(upperPercentile / 100 * n));
        double lower = sorted[lowerIdx];
        double upper = sorted[upperIdx];

        double point = round(mean, 2);
        double widthPct = point != 0 ? Math.round((upper - lower) / Math.abs(point) * 100) : 0;
        return new UncertaintyBand(point, round(lower, 2), round(upper, 2), round(Math.sqrt(variance), 2), widthPct);
    }

    static CalibrationSignal signal(UncertaintyBand confidence) {
        if (confidence.width() > WIDE_BAND) {
            return CalibrationSignal.UNCERTAIN;
        }
        if (confidence.point() > confidence.upper() - EDGE_MARGIN) {
            return CalibrationSignal.OVERCONFIDENT;
        }
        if (confidence.point() < confidence.lower() + EDGE_MARGIN) {
            return CalibrationSignal.UNDERCONFIDENT;
        }
        return CalibrationSignal.WELL_CALIBRATED;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
