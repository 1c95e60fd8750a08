package org.jstats.forecast_api.modules.prediction.service;

import org.jstats.forecast_api.modules.prediction.model.AlgorithmConfig;
import org.jstats.forecast_api.modules.prediction.model.AlgorithmConfig.Thresholds;
import org.jstats.forecast_api.modules.prediction.model.AlgorithmConfig.Weights;
import org.jstats.forecast_api.modules.prediction.model.PredictionFactors;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps algorithm identifiers to their configuration and hooks.
 * Identifiers are the ones persisted with every prediction, so they never change.
 */
@Component
public class AlgorithmRegistry {

    public static final String ML_POWER_INDEX = "f4ce9fdc-c41a-4a5c-9f18-5d732674c5b8";
    public static final String VALUE_PICK_FINDER = "3a7e2d9b-8c5f-4b1f-9e17-7b31a4dce6c2";
    public static final String STATISTICAL_EDGE = "85c48bbe-5b1a-4c1e-a0d5-e284e9e952f1";

    static final double MAX_CONFIDENCE = 85;

    private static final double MOMENTUM_EXTREMITY = 20;
    private static final double MOMENTUM_BONUS = 3;
    private static final double VALUE_EV_PCT = 5;
    private static final double VALUE_BONUS = 5;
    private static final int STAT_EDGE_MIN_GAMES = 5;
    private static final double STAT_EDGE_MULTIPLIER = 1.5;

    private final Map<String, AlgorithmDefinition> definitions;

    public AlgorithmRegistry() {
        Map<String, AlgorithmDefinition> map = new LinkedHashMap<>();
        register(map, mlPowerIndex());
        register(map, valuePickFinder());
        register(map, statisticalEdge());
        this.definitions = Collections.unmodifiableMap(map);
    }

    public List<AlgorithmDefinition> all() {
        return List.copyOf(definitions.values());
    }

    public List<String> ids() {
        return List.copyOf(definitions.keySet());
    }

    public boolean contains(String algorithmId) {
        return definitions.containsKey(algorithmId);
    }

    /**
     * Registered definition, or a default-tuned predictor carrying the unknown id.
     */
    public AlgorithmDefinition definition(String algorithmId) {
        AlgorithmDefinition known = definitions.get(algorithmId);
        if (known != null) {
            return known;
        }
        return new AlgorithmDefinition(AlgorithmConfig.defaults(algorithmId, "Default Algorithm"), PredictionHooks.NONE);
    }

    public String nameOf(String algorithmId) {
        AlgorithmDefinition known = definitions.get(algorithmId);
        return known != null ? known.name() : "Unknown";
    }

    private static void register(Map<String, AlgorithmDefinition> map, AlgorithmDefinition definition) {
        map.put(definition.id(), definition);
    }

    // Extra weight on momentum swings
    static AlgorithmDefinition mlPowerIndex() {
        AlgorithmConfig config = new AlgorithmConfig(
                ML_POWER_INDEX,
                "ML Power Index",
                "Historical data and performance trend analysis",
                "2.0.0",
                new Weights(0.35, 0.12, 0.25, 0.18, 0.05, 0.05),
                new Thresholds(42, 48, 68));
        return new AlgorithmDefinition(config, PredictionHooks.ofConfidence((confidence, factors, cfg) -> {
            double bonus = Math.abs(factors.momentum().differential()) > MOMENTUM_EXTREMITY ? MOMENTUM_BONUS : 0;
            return Math.max(cfg.thresholds().minConfidence(), Math.min(MAX_CONFIDENCE, confidence + bonus));
        }));
    }

    // Prioritises expected value over raw confidence
    static AlgorithmDefinition valuePickFinder() {
        AlgorithmConfig config = new AlgorithmConfig(
                VALUE_PICK_FINDER,
                "Value Pick Finder",
                "Odds analysis and market inefficiencies",
                "2.0.0",
                new Weights(0.25, 0.10, 0.15, 0.10, 0.15, 0.25),
                new Thresholds(45, 50, 62));
        return new AlgorithmDefinition(config, PredictionHooks.ofResult(result ->
                result.evPercentage() > VALUE_EV_PCT
                        ? result.withConfidence(Math.min(MAX_CONFIDENCE, result.confidence() + VALUE_BONUS))
                        : result));
    }

    // Trusts head-to-head history more once the sample is meaningful
    static AlgorithmDefinition statisticalEdge() {
        AlgorithmConfig config = new AlgorithmConfig(
                STATISTICAL_EDGE,
                "Statistical Edge",
                "Situational advantages and matchup statistics",
                "2.0.0",
                new Weights(0.30, 0.20, 0.15, 0.25, 0.05, 0.05),
                new Thresholds(40, 46, 70));
        return new AlgorithmDefinition(config, PredictionHooks.ofFactors(factors -> {
            PredictionFactors.HistoricalFactor historical = factors.historical();
            if (historical == null || historical.data().totalGames() < STAT_EDGE_MIN_GAMES) {
                return factors;
            }
            return factors.withHistorical(new PredictionFactors.HistoricalFactor(
                    historical.data(), historical.impact() * STAT_EDGE_MULTIPLIER));
        }));
    }
}
