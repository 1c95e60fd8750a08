package org.jstats.forecast_api.modules.prediction.service;

import org.jstats.forecast_api.modules.prediction.model.AlgorithmConfig;

/**
 * A registered predictor: its tuning plus the hooks that make it a variant.
 */
public record AlgorithmDefinition(AlgorithmConfig config, PredictionHooks hooks) {

    public String id() {
        return config.id();
    }

    public String name() {
        return config.name();
    }
}
