package org.jstats.forecast_api.modules.calibration.service;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.forecast_api.modules.calibration.model.AlgorithmPerformanceWindow;
import org.jstats.forecast_api.modules.calibration.model.BinCalibrationResult;
import org.jstats.forecast_api.modules.calibration.model.BinCalibrationResult.CalibratedConfidence;
import org.jstats.forecast_api.modules.calibration.model.CalibrationConfig;
import org.jstats.forecast_api.modules.calibration.model.CalibrationOutcome;
import org.jstats.forecast_api.modules.calibration.model.ModelWeight;
import org.jstats.forecast_api.modules.calibration.model.RecalibrationAction;
import org.jstats.forecast_api.modules.calibration.model.RecalibrationRecommendation;
import org.jstats.forecast_api.modules.calibration.model.RecalibrationRecommendation.Severity;
import org.jstats.forecast_api.modules.calibration.model.WeightAdjustment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.jstats.forecast_api.modules.prediction.service.WagerMath.round;

/**
 * Closes the feedback loop: compares each algorithm's realized win rate with the
 * confidence it stated and derives a weight, a confidence multiplier and a minimum
 * confidence threshold from the gap.
 * <p>
 * Nothing is adjusted until an algorithm has {@link CalibrationConfig#minBets()} decided bets.
 */
@Service
@NullMarked
public class ModelCalibrationService {

    private static final Logger log = LoggerFactory.getLogger(ModelCalibrationService.class);

    static final double PAUSED_WEIGHT = 0.05;
    static final double MIN_WEIGHT = 0.05;
    static final double MAX_WEIGHT = 0.6;
    static final double BASE_THRESHOLD = 55;
    private static final double MAX_THRESHOLD = 75;
    private static final double SIGNIFICANT_WEIGHT_CHANGE = 0.05;

    private final CalibrationConfig defaultConfig;
    private final BinCalibrator binCalibrator;
    private final Clock clock;

    public ModelCalibrationService(CalibrationConfig defaultConfig, BinCalibrator binCalibrator, Clock clock) {
        this.defaultConfig = defaultConfig;
        this.binCalibrator = binCalibrator;
        this.clock = clock;
    }

    public CalibrationOutcome calculateModelWeights(List<AlgorithmPerformanceWindow> windows) {
        return calculateModelWeights(windows, null);
    }

    public CalibrationOutcome calculateModelWeights(List<AlgorithmPerformanceWindow> windows,
                                                    @Nullable CalibrationConfig config) {
        CalibrationConfig cfg = config != null ? config : defaultConfig;
        Instant now = clock.instant();

        List<ModelWeight> weights = new ArrayList<>(windows.size());
        List<RecalibrationAction> actions = new ArrayList<>();
        List<RecalibrationRecommendation> recommendations = new ArrayList<>(windows.size());

        for (AlgorithmPerformanceWindow window : windows) {
            double baseWeight = cfg.baseWeightFor(window.algorithmId());
            AdjustedWeight adjusted = adjustedWeight(window, baseWeight, cfg);
            double multiplier = confidenceMultiplier(window, cfg);
            double threshold = minConfidenceThreshold(window, cfg);

            weights.add(new ModelWeight(window.algorithmId(), window.algorithmName(), baseWeight,
                    adjusted.weight(), adjusted.reason(), multiplier, threshold, now));

            if (Math.abs(adjusted.weight() - baseWeight) > SIGNIFICANT_WEIGHT_CHANGE) {
                actions.add(new RecalibrationAction(
                        window.algorithmId(),
                        adjusted.weight() > baseWeight
                                ? RecalibrationAction.Type.WEIGHT_INCREASED
                                : RecalibrationAction.Type.WEIGHT_DECREASED,
                        baseWeight,
                        adjusted.weight(),
                        adjusted.reason()));
            }
            if (multiplier != 1.0) {
                actions.add(new RecalibrationAction(
                        window.algorithmId(),
                        RecalibrationAction.Type.CONFIDENCE_MULTIPLIER_ADJUSTED,
                        1.0,
                        multiplier,
                        "Based on " + oneDecimal(window.performanceVsExpected()) + "% calibration error"));
            }
            recommendations.add(recommend(window, cfg));
        }

        double total = weights.stream().mapToDouble(ModelWeight::adjustedWeight).sum();
        List<ModelWeight> normalized = total > 0
                ? weights.stream().map(w -> w.withAdjustedWeight(w.adjustedWeight() / total)).toList()
                : weights;

        if (log.isInfoEnabled()) {
            log.info("Calibrated {} algorithms: {} actions, {} paused", windows.size(), actions.size(),
                    recommendations.stream().filter(r -> r.type() == RecalibrationRecommendation.Type.PAUSE_ALGORITHM).count());
        }
        return new CalibrationOutcome(normalized, actions, recommendations);
    }

    /**
     * Scales a raw confidence by the algorithm's calibrated multiplier and checks it
     * against its threshold. Algorithms without a calibrated weight pass through at 55.
     */
    public WeightAdjustment applyWeightAdjustment(double confidence, String algorithmId, List<ModelWeight> weights) {
        return applyWeightAdjustment(confidence, algorithmId, weights, null);
    }

    /**
     * As {@link #applyWeightAdjustment(double, String, List)}, with the multiplied confidence
     * then passed through its confidence bin before the threshold check.
     */
    public WeightAdjustment applyWeightAdjustment(double confidence, String algorithmId, List<ModelWeight> weights,
                                                  @Nullable BinCalibrationResult bins) {
        ModelWeight weight = weights.stream()
                .filter(w -> w.algorithmId().equals(algorithmId))
                .findFirst()
                .orElse(null);
        double adjusted = weight != null ? confidence * weight.confidenceMultiplier() : confidence;
        double threshold = weight != null ? weight.minConfidenceThreshold() : BASE_THRESHOLD;
        double share = weight != null ? weight.adjustedWeight() : defaultConfig.defaultBaseWeight();

        CalibratedConfidence binned = null;
        if (bins != null) {
            binned = binCalibrator.apply(adjusted, bins);
            adjusted = binned.calibratedConfidence();
        }
        return new WeightAdjustment(round(adjusted, 1), adjusted >= threshold, share, binned);
    }

    record AdjustedWeight(double weight, String reason) {}

    static AdjustedWeight adjustedWeight(AlgorithmPerformanceWindow window, double baseWeight, CalibrationConfig config) {
        if (window.totalBets() < config.minBets()) {
            return new AdjustedWeight(baseWeight, "Insufficient data for adjustment");
        }
        if (PerformanceAnalyzer.shouldPause(window)) {
            return new AdjustedWeight(PAUSED_WEIGHT, "Paused due to severe underperformance");
        }

        double adjustment = 0;
        StringBuilder reason = new StringBuilder();
        if (window.underperforming()) {
            adjustment = -Math.min(Math.abs(window.performanceVsExpected()) / 100 * 0.3, config.maxWeightChange());
            reason.append("Reduced: ").append(oneDecimal(window.performanceVsExpected())).append("% below expected");
        } else if (window.overperforming()) {
            adjustment = Math.min(window.performanceVsExpected() / 100 * 0.2, config.maxWeightChange());
            reason.append("Boosted: ").append(oneDecimal(window.performanceVsExpected())).append("% above expected");
        } else {
            reason.append("Performing as expected");
        }

        if (window.streak() <= -config.coldStreakThreshold()) {
            adjustment -= 0.05;
            reason.append(" (cold streak: ").append(Math.abs(window.streak())).append(" losses)");
        } else if (window.streak() >= config.hotStreakThreshold()) {
            adjustment += 0.03;
            reason.append(" (hot streak: ").append(window.streak()).append(" wins)");
        }

        return new AdjustedWeight(Math.max(MIN_WEIGHT, Math.min(MAX_WEIGHT, baseWeight + adjustment)), reason.toString());
    }

    static double confidenceMultiplier(AlgorithmPerformanceWindow window, CalibrationConfig config) {
        if (window.totalBets() < config.minBets()) {
            return 1.0;
        }
        double multiplier = 1.0;
        double calibrationError = window.performanceVsExpected() / 100;
        if (window.underperforming()) {
            multiplier = 1 - Math.min(Math.abs(calibrationError) * 0.5, config.maxConfidenceReduction() / 100);
        } else if (window.overperforming()) {
            multiplier = 1 + Math.min(calibrationError * 0.3, config.maxConfidenceBoost() / 100);
        }

        if (window.streak() <= -3) {
            multiplier *= 0.95;
        } else if (window.streak() >= 3) {
            multiplier *= 1.02;
        }
        return Math.max(0.7, Math.min(1.15, multiplier));
    }

    static double minConfidenceThreshold(AlgorithmPerformanceWindow window, CalibrationConfig config) {
        if (window.totalBets() < config.minBets()) {
            return BASE_THRESHOLD;
        }
        if (window.underperforming()) {
            double increase = Math.min(Math.abs(window.performanceVsExpected()) * 0.3, 15);
            return Math.min(BASE_THRESHOLD + increase, MAX_THRESHOLD);
        }
        if (window.overperforming()) {
            double decrease = Math.min(window.performanceVsExpected() * 0.2, 10);
            return Math.max(BASE_THRESHOLD - decrease, config.minConfidenceFloor());
        }
        return BASE_THRESHOLD;
    }

    static RecalibrationRecommendation recommend(AlgorithmPerformanceWindow window, CalibrationConfig config) {
        int health = PerformanceAnalyzer.healthScore(window);
        String name = window.algorithmName();

        if (window.totalBets() < config.minBets()) {
            return new RecalibrationRecommendation(
                    RecalibrationRecommendation.Type.NO_CHANGE, window.algorithmId(), name, Severity.LOW,
                    name + " has too few settled bets to judge",
                    "No adjustment needed",
                    window.totalBets() + " of " + config.minBets() + " bets required",
                    health);
        }
        if (PerformanceAnalyzer.shouldPause(window)) {
            return new RecalibrationRecommendation(
                    RecalibrationRecommendation.Type.PAUSE_ALGORITHM, window.algorithmId(), name, Severity.CRITICAL,
                    name + " is severely underperforming and should be paused",
                    "Temporarily pause this algorithm until performance improves",
                    "Currently " + oneDecimal(window.winRate()) + "% win rate vs "
                            + oneDecimal(window.expectedWinRate()) + "% expected",
                    health);
        }
        if (window.underperforming()) {
            return new RecalibrationRecommendation(
                    RecalibrationRecommendation.Type.DECREASE_CONFIDENCE, window.algorithmId(), name,
                    window.performanceVsExpected() < -15 ? Severity.HIGH : Severity.MEDIUM,
                    name + " is underperforming expectations",
                    "Reduce confidence weight and increase minimum threshold",
                    oneDecimal(window.performanceVsExpected()) + "% below expected win rate",
                    health);
        }
        if (window.overperforming()) {
            return new RecalibrationRecommendation(
                    RecalibrationRecommendation.Type.BOOST_ALGORITHM, window.algorithmId(), name, Severity.LOW,
                    name + " is exceeding expectations",
                    "Consider increasing weight for this algorithm",
                    "+" + oneDecimal(window.performanceVsExpected()) + "% above expected win rate",
                    health);
        }
        return new RecalibrationRecommendation(
                RecalibrationRecommendation.Type.NO_CHANGE, window.algorithmId(), name, Severity.LOW,
                name + " is performing as expected",
                "No adjustment needed",
                "Within " + oneDecimal(config.underperformanceThreshold()) + "% of expected performance",
                health);
    }

    private static String oneDecimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
