package org.jstats.forecast_api.modules.prediction.service;

import org.jstats.forecast_api.modules.prediction.model.AlgorithmConfig;
import org.jstats.forecast_api.modules.prediction.model.PredictionFactors;
import org.jstats.forecast_api.modules.prediction.model.PredictionResult;

/**
 * The three points where an algorithm variant may depart from the shared pipeline.
 * Each hook is a pure function; the identity hooks leave the pipeline untouched.
 */
public record PredictionHooks(
        FactorAdjuster factors,
        ConfidenceAdjuster confidence,
        ResultAdjuster result
) {
    public static final PredictionHooks NONE = new PredictionHooks(
            f -> f,
            (c, f, config) -> c,
            r -> r);

    @FunctionalInterface
    public interface FactorAdjuster {
        PredictionFactors apply(PredictionFactors factors);
    }

    @FunctionalInterface
    public interface ConfidenceAdjuster {
        double apply(double confidence, PredictionFactors factors, AlgorithmConfig config);
    }

    @FunctionalInterface
    public interface ResultAdjuster {
        PredictionResult apply(PredictionResult result);
    }

    public static PredictionHooks ofFactors(FactorAdjuster factors) {
        return new PredictionHooks(factors, NONE.confidence, NONE.result);
    }

    public static PredictionHooks ofConfidence(ConfidenceAdjuster confidence) {
        return new PredictionHooks(NONE.factors, confidence, NONE.result);
    }

    public static PredictionHooks ofResult(ResultAdjuster result) {
        return new PredictionHooks(NONE.factors, NONE.confidence, result);
    }
}
