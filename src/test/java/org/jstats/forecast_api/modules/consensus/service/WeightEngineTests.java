package org.jstats.forecast_api.modules.consensus.service;

import org.jstats.forecast_api.modules.consensus.model.AlgorithmStats;
import org.jstats.forecast_api.modules.consensus.model.AlgorithmWeight;
import org.jstats.forecast_api.modules.consensus.repository.AlgorithmStatsRepository;
import org.jstats.forecast_api.modules.prediction.service.AlgorithmRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class WeightEngineTests {

    AlgorithmStatsRepository repo;
    WeightEngine engine;

    @BeforeEach
    void setUp() {
        repo = mock(AlgorithmStatsRepository.class);
        engine = new WeightEngine(repo, new AlgorithmRegistry());
    }

    private static double sum(List<AlgorithmWeight> weights) {
        return weights.stream().mapToDouble(AlgorithmWeight::weight).sum();
    }

    @Test
    void noStats_equalWeightsOverRegisteredAlgorithms() {
        when(repo.findAll()).thenReturn(List.of());

        List<AlgorithmWeight> weights = engine.fetchWeights();

        assertEquals(3, weights.size());
        weights.forEach(w -> {
            assertEquals(1.0 / 3, w.weight(), 1e-9);
            assertEquals(50, w.winRate(), 1e-9);
            assertEquals(0, w.reliability(), 1e-9);
        });
        assertEquals(1.0, sum(weights), 1e-9);
    }

    @Test
    void repositoryFailure_fallsBackToEqualWeights() {
        when(repo.findAll()).thenThrow(new DataAccessResourceFailureException("down"));

        assertEquals(engine.defaultWeights(), engine.fetchWeights());
    }

    @Test
    void accurateAndCalibratedAlgorithm_earnsMoreWeight() {
        when(repo.findAll()).thenReturn(List.of(
                new AlgorithmStats(AlgorithmRegistry.ML_POWER_INDEX, 70.0, 30, 21, 70.0),
                new AlgorithmStats(AlgorithmRegistry.VALUE_PICK_FINDER, 50.0, 30, 15, 50.0)));

        List<AlgorithmWeight> weights = engine.fetchWeights();

        // raw 0.7 and 0.5
        assertEquals(0.7 / 1.2, weights.get(0).weight(), 1e-9);
        assertEquals(0.5 / 1.2, weights.get(1).weight(), 1e-9);
        assertEquals(1.0, sum(weights), 1e-9);
        assertEquals("ML Power Index", weights.get(0).algorithmName());
        assertEquals(1.0, weights.get(0).reliability(), 1e-9);
    }

    @Test
    void smallSample_isShrunkTowardFifty() {
        List<AlgorithmWeight> weights = engine.computeWeights(List.of(
                new AlgorithmStats("a", 90.0, 3, 3, 90.0),
                new AlgorithmStats("b", 90.0, 30, 27, 90.0)));

        assertTrue(weights.get(0).weight() < weights.get(1).weight());
        assertEquals(0.1, weights.get(0).reliability(), 1e-9);
    }

    @Test
    void overconfidentAlgorithm_losesCalibrationBonus() {
        List<AlgorithmWeight> weights = engine.computeWeights(List.of(
                new AlgorithmStats("honest", 60.0, 30, 18, 60.0),
                new AlgorithmStats("boastful", 60.0, 30, 18, 85.0)));

        assertTrue(weights.get(0).weight() > weights.get(1).weight());
    }

    @Test
    void nullColumns_readAsDefaults() {
        List<AlgorithmWeight> weights = engine.computeWeights(List.of(
                new AlgorithmStats("a", null, null, null, null),
                new AlgorithmStats("b", null, null, null, null)));

        assertEquals(0.5, weights.get(0).weight(), 1e-9);
        assertEquals(0, weights.get(0).totalPredictions());
        assertEquals("Unknown", weights.get(0).algorithmName());
    }

    @Test
    void reliability_saturatesAtThirtySamples() {
        assertEquals(0, WeightEngine.reliability(0), 1e-9);
        assertEquals(0.5, WeightEngine.reliability(15), 1e-9);
        assertEquals(1, WeightEngine.reliability(300), 1e-9);
    }
}
