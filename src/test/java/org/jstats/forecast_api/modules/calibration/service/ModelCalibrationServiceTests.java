package org.jstats.forecast_api.modules.calibration.service;

import org.jstats.forecast_api.modules.calibration.model.AlgorithmPerformanceWindow;
import org.jstats.forecast_api.modules.calibration.model.BinCalibrationResult;
import org.jstats.forecast_api.modules.calibration.model.CalibrationConfig;
import org.jstats.forecast_api.modules.calibration.model.CalibrationOutcome;
import org.jstats.forecast_api.modules.calibration.model.ModelWeight;
import org.jstats.forecast_api.modules.calibration.model.RecalibrationAction;
import org.jstats.forecast_api.modules.calibration.model.RecalibrationRecommendation;
import org.jstats.forecast_api.modules.calibration.model.WeightAdjustment;
import org.jstats.forecast_api.modules.prediction.model.PredictionStatus;
import org.jstats.forecast_api.modules.prediction.model.Recommendation;
import org.jstats.forecast_api.modules.prediction.model.StoredPrediction;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.jstats.forecast_api.modules.prediction.PredictionFixtures.NOW;
import static org.jstats.forecast_api.modules.prediction.PredictionFixtures.stored;
import static org.junit.jupiter.api.Assertions.*;

class ModelCalibrationServiceTests {

    private static final CalibrationConfig CONFIG = CalibrationConfig.defaults(Map.of(
            "ml", 0.34,
            "value", 0.33,
            "edge", 0.33));

    private final ModelCalibrationService service = new ModelCalibrationService(CONFIG, new BinCalibrator(),
            Clock.fixed(NOW, ZoneOffset.UTC));

    private static AlgorithmPerformanceWindow window(String id, int bets, int wins, double expected, int streak) {
        double winRate = bets > 0 ? (double) wins / bets * 100 : 0;
        double delta = winRate - expected;
        return new AlgorithmPerformanceWindow(id, id.toUpperCase(), 30, bets, wins, bets - wins, winRate, expected,
                delta, bets >= 10 && delta < -10, bets >= 10 && delta > 10, streak, expected, List.of());
    }

    // 50 bets at 40% against 60% stated
    private static final AlgorithmPerformanceWindow UNDER = window("ml", 50, 20, 60, -2);

    @Test
    void underperformer_losesWeightAndConfidence() {
        var adjusted = ModelCalibrationService.adjustedWeight(UNDER, 0.34, CONFIG);

        assertEquals(0.28, adjusted.weight(), 1e-9);
        assertEquals("Reduced: -20.0% below expected", adjusted.reason());
        assertEquals(0.9, ModelCalibrationService.confidenceMultiplier(UNDER, CONFIG), 1e-9);
        assertEquals(61, ModelCalibrationService.minConfidenceThreshold(UNDER, CONFIG), 1e-9);

        RecalibrationRecommendation recommendation = ModelCalibrationService.recommend(UNDER, CONFIG);
        assertEquals(RecalibrationRecommendation.Type.DECREASE_CONFIDENCE, recommendation.type());
        assertEquals(RecalibrationRecommendation.Severity.HIGH, recommendation.severity());
    }

    @Test
    void overperformer_gainsWeightAndCanLowerItsThreshold() {
        AlgorithmPerformanceWindow over = window("value", 40, 30, 55, 4);

        var adjusted = ModelCalibrationService.adjustedWeight(over, 0.33, CONFIG);

        // +min(20/100*0.2, 0.15)
        assertEquals(0.37, adjusted.weight(), 1e-9);
        assertTrue(adjusted.reason().startsWith("Boosted: 20.0% above expected"));
        assertEquals(1.06 * 1.02, ModelCalibrationService.confidenceMultiplier(over, CONFIG), 1e-9);
        assertEquals(51, ModelCalibrationService.minConfidenceThreshold(over, CONFIG), 1e-9);
        assertEquals(RecalibrationRecommendation.Type.BOOST_ALGORITHM, ModelCalibrationService.recommend(over, CONFIG).type());
    }

    @Test
    void streaksNudgeTheWeight() {
        var cold = ModelCalibrationService.adjustedWeight(window("edge", 20, 10, 50, -5), 0.33, CONFIG);
        var hot = ModelCalibrationService.adjustedWeight(window("edge", 20, 10, 50, 6), 0.33, CONFIG);

        assertEquals(0.28, cold.weight(), 1e-9);
        assertEquals("Performing as expected (cold streak: 5 losses)", cold.reason());
        assertEquals(0.36, hot.weight(), 1e-9);
        assertEquals("Performing as expected (hot streak: 6 wins)", hot.reason());
    }

    @Test
    void tooFewBets_changesNothing() {
        AlgorithmPerformanceWindow sparse = window("edge", 6, 0, 70, -6);

        var adjusted = ModelCalibrationService.adjustedWeight(sparse, 0.33, CONFIG);

        assertEquals(0.33, adjusted.weight(), 1e-9);
        assertEquals("Insufficient data for adjustment", adjusted.reason());
        assertEquals(1.0, ModelCalibrationService.confidenceMultiplier(sparse, CONFIG), 1e-9);
        assertEquals(55, ModelCalibrationService.minConfidenceThreshold(sparse, CONFIG), 1e-9);
        assertEquals(RecalibrationRecommendation.Type.NO_CHANGE, ModelCalibrationService.recommend(sparse, CONFIG).type());
    }

    @Test
    void severeUnderperformer_isPaused() {
        AlgorithmPerformanceWindow broken = window("ml", 20, 5, 60, -9);

        var adjusted = ModelCalibrationService.adjustedWeight(broken, 0.34, CONFIG);
        RecalibrationRecommendation recommendation = ModelCalibrationService.recommend(broken, CONFIG);

        assertEquals(0.05, adjusted.weight(), 1e-9);
        assertEquals("Paused due to severe underperformance", adjusted.reason());
        assertEquals(RecalibrationRecommendation.Type.PAUSE_ALGORITHM, recommendation.type());
        assertEquals(RecalibrationRecommendation.Severity.CRITICAL, recommendation.severity());
    }

    @Test
    void multiplierStaysWithinBounds() {
        CalibrationConfig loose = new CalibrationConfig(10, 10, 10, 0.15, 90, 90, 45, 5, 5, 30, Map.of(), 0.33);

        double low = ModelCalibrationService.confidenceMultiplier(window("a", 100, 10, 90, -4), loose);
        double high = ModelCalibrationService.confidenceMultiplier(window("a", 100, 100, 30, 4), loose);

        assertEquals(0.7, low, 1e-9);
        assertEquals(1.15, high, 1e-9);
    }

    @Test
    void calculateModelWeights_normalizesAndReportsActions() {
        CalibrationOutcome outcome = service.calculateModelWeights(List.of(
                UNDER,
                window("value", 0, 0, 50, 0),
                window("edge", 0, 0, 50, 0)));

        List<ModelWeight> weights = outcome.weights();
        assertEquals(1.0, weights.stream().mapToDouble(ModelWeight::adjustedWeight).sum(), 1e-9);
        assertEquals(0.28 / 0.94, weights.get(0).adjustedWeight(), 1e-9);
        assertEquals(0.34, weights.get(0).baseWeight(), 1e-9);
        assertEquals(NOW, weights.get(0).lastUpdated());

        assertEquals(List.of(
                RecalibrationAction.Type.WEIGHT_DECREASED,
                RecalibrationAction.Type.CONFIDENCE_MULTIPLIER_ADJUSTED),
                outcome.actions().stream().map(RecalibrationAction::action).toList());
        assertEquals(3, outcome.recommendations().size());
    }

    @Test
    void applyWeightAdjustment_usesCalibratedMultiplierAndThreshold() {
        List<ModelWeight> weights = service.calculateModelWeights(List.of(UNDER)).weights();

        WeightAdjustment passes = service.applyWeightAdjustment(70, "ml", weights);
        WeightAdjustment fails = service.applyWeightAdjustment(65, "ml", weights);

        assertEquals(63, passes.adjustedConfidence(), 1e-9);
        assertTrue(passes.meetsThreshold());
        assertEquals(58.5, fails.adjustedConfidence(), 1e-9);
        assertFalse(fails.meetsThreshold());
        assertEquals(1.0, passes.weight(), 1e-9);
    }

    @Test
    void applyWeightAdjustment_uncalibratedAlgorithmPassesThrough() {
        WeightAdjustment adjustment = service.applyWeightAdjustment(70, "new-alg", List.of());

        assertEquals(70, adjustment.adjustedConfidence(), 1e-9);
        assertTrue(adjustment.meetsThreshold());
        assertEquals(0.33, adjustment.weight(), 1e-9);
        assertFalse(service.applyWeightAdjustment(54, "new-alg", List.of()).meetsThreshold());
    }

    @Test
    void applyWeightAdjustment_binsApplyAfterTheMultiplier() {
        List<ModelWeight> weights = service.calculateModelWeights(List.of(UNDER)).weights();
        // 4 of 10 won in the 60-64% range
        List<StoredPrediction> history = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            history.add(stored(i + 1, "ml", Recommendation.HOME, 62,
                    i < 4 ? PredictionStatus.WON : PredictionStatus.LOST, NOW));
        }
        BinCalibrationResult bins = new BinCalibrator().analyze(history);

        WeightAdjustment scaled = service.applyWeightAdjustment(70, "ml", weights, bins);
        WeightAdjustment untouched = service.applyWeightAdjustment(65, "ml", weights, bins);

        // 70 * 0.9 = 63 lands in 60-64%, 63 * 0.7 is clamped to 45
        assertEquals(45, scaled.adjustedConfidence(), 1e-9);
        assertFalse(scaled.meetsThreshold());
        assertEquals("60-64%", scaled.binAdjustment().binLabel());
        assertEquals(0.7, scaled.binAdjustment().adjustmentFactor(), 1e-9);
        assertEquals(58.5, untouched.adjustedConfidence(), 1e-9);
        assertFalse(untouched.binAdjustment().wasAdjusted());
    }

    @Test
    void applyWeightAdjustment_withoutBinsHasNoBinStep() {
        assertNull(service.applyWeightAdjustment(70, "new-alg", List.of()).binAdjustment());
        assertNull(service.applyWeightAdjustment(70, "new-alg", List.of(), null).binAdjustment());
    }
}
