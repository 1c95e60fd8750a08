package org.jstats.forecast_api.modules.montecarlo.service;

import org.jstats.forecast_api.modules.consensus.model.AlgorithmWeight;
import org.jstats.forecast_api.modules.montecarlo.model.CalibrationSignal;
import org.jstats.forecast_api.modules.montecarlo.model.MonteCarloConfig;
import org.jstats.forecast_api.modules.montecarlo.model.MonteCarloResult;
import org.jstats.forecast_api.modules.montecarlo.model.UncertaintyBand;
import org.jstats.forecast_api.modules.prediction.model.PredictionResult;
import org.jstats.forecast_api.modules.prediction.model.Recommendation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.jstats.forecast_api.modules.prediction.PredictionFixtures.prediction;
import static org.junit.jupiter.api.Assertions.*;

class MonteCarloSimulatorTests {

    private static final MonteCarloConfig SEEDED = MonteCarloConfig.DEFAULT.withSeed(42L);

    private final MonteCarloSimulator simulator = new MonteCarloSimulator(MonteCarloConfig.DEFAULT);

    private static List<PredictionResult> panel() {
        return List.of(
                prediction("a", Recommendation.HOME, 70, 8),
                prediction("b", Recommendation.HOME, 70, 8),
                prediction("c", Recommendation.HOME, 70, 8));
    }

    private static List<AlgorithmWeight> weights() {
        return List.of(
                new AlgorithmWeight("a", "a", 0.4, 55, 40, 60, 1),
                new AlgorithmWeight("b", "b", 0.3, 52, 40, 60, 1),
                new AlgorithmWeight("c", "c", 0.3, 50, 40, 60, 1));
    }

    @Test
    void bandsBracketThePointEstimate() {
        MonteCarloResult result = simulator.run(panel(), weights(), SEEDED);

        assertEquals(200, result.numSamples());
        UncertaintyBand confidence = result.confidence();
        assertTrue(confidence.lower() <= confidence.point());
        assertTrue(confidence.point() <= confidence.upper());
        assertEquals(70, confidence.point(), 2.0);
        assertTrue(confidence.stdDev() > 0);
        assertTrue(result.trueProbability().lower() >= 0.05);
        assertTrue(result.projectedScoreHome().lower() >= 0);
    }

    @Test
    void pickDistribution_sumsToOne_andStabilityIsItsMaximum() {
        MonteCarloResult result = simulator.run(panel(), weights(), SEEDED);

        double total = result.pickDistribution().values().stream().mapToDouble(Double::doubleValue).sum();
        double max = result.pickDistribution().values().stream().mapToDouble(Double::doubleValue).max().orElse(0);
        assertEquals(1.0, total, 1e-9);
        assertEquals(max, result.pickStability(), 1e-9);
        assertTrue(result.pickDistribution().keySet().stream()
                .allMatch(k -> k.equals("home") || k.equals("away") || k.equals("skip")));
    }

    @Test
    void sameSeed_reproducesTheRun() {
        assertEquals(simulator.run(panel(), weights(), SEEDED), simulator.run(panel(), weights(), SEEDED));
    }

    @Test
    void emptyPanel_returnsEmptyResult() {
        MonteCarloResult result = simulator.run(List.of(), List.of(), null);

        assertEquals(UncertaintyBand.EMPTY, result.confidence());
        assertEquals(0, result.pickStability(), 1e-9);
        assertTrue(result.pickDistribution().isEmpty());
        assertEquals(CalibrationSignal.UNCERTAIN, result.calibrationSignal());
        assertEquals(200, result.numSamples());
    }

    @Test
    void noSamples_returnsEmptyResult() {
        MonteCarloResult none = simulator.run(panel(), weights(), SEEDED.withNumSamples(0));
        MonteCarloResult negative = simulator.run(panel(), weights(), SEEDED.withNumSamples(-5));

        assertEquals(CalibrationSignal.UNCERTAIN, none.calibrationSignal());
        assertEquals(UncertaintyBand.EMPTY, none.confidence());
        assertEquals(0, none.numSamples());
        assertEquals(CalibrationSignal.UNCERTAIN, negative.calibrationSignal());
        assertTrue(negative.pickDistribution().isEmpty());
        assertEquals(0, negative.numSamples());
    }

    @Test
    void everySampleCompletes() {
        MonteCarloResult result = simulator.run(panel(), weights(), SEEDED.withNumSamples(37));

        assertEquals(37, result.numSamples());
        double total = result.pickDistribution().values().stream().mapToDouble(Double::doubleValue).sum();
        assertEquals(1.0, total, 1e-9);
    }

    @Test
    void band_usesFlooredPercentileIndices() {
        UncertaintyBand band = MonteCarloSimulator.band(new double[]{10, 9, 8, 7, 6, 5, 4, 3, 2, 1}, 10, 90);

        assertEquals(5.5, band.point(), 1e-9);
        assertEquals(2, band.lower(), 1e-9);
        assertEquals(10, band.upper(), 1e-9);
        assertEquals(145, band.widthPct(), 1e-9);
    }

    @Test
    void band_zeroPointHasZeroWidthPct() {
        UncertaintyBand band = MonteCarloSimulator.band(new double[]{-1, 1}, 10, 90);

        assertEquals(0, band.point(), 1e-9);
        assertEquals(0, band.widthPct(), 1e-9);
    }

    @Test
    void signal_readsBandShape() {
        assertEquals(CalibrationSignal.UNCERTAIN, MonteCarloSimulator.signal(new UncertaintyBand(70, 60, 85, 8, 36)));
        assertEquals(CalibrationSignal.OVERCONFIDENT, MonteCarloSimulator.signal(new UncertaintyBand(70, 65, 72, 2, 10)));
        assertEquals(CalibrationSignal.UNDERCONFIDENT, MonteCarloSimulator.signal(new UncertaintyBand(70, 68, 80, 3, 17)));
        assertEquals(CalibrationSignal.WELL_CALIBRATED, MonteCarloSimulator.signal(new UncertaintyBand(70, 65, 78, 4, 19)));
    }

    @Test
    void gaussianSampler_isDeterministicPerSeed() {
        GaussianSampler first = GaussianSampler.of(7L);
        GaussianSampler second = GaussianSampler.of(7L);

        for (int i = 0; i < 10; i++) {
            assertEquals(first.next(0, 1), second.next(0, 1));
        }
    }
}
