package org.jstats.forecast_api.modules.ensemble.model;

import java.util.Map;

/**
 * Outcome of the boosting layer, keyed by algorithm id in prediction order.
 */
public record BoostingState(Map<String, Double> residuals, Map<String, Double> adjustments, int rounds) {

    public double meanAdjustment() {
        return adjustments.values().stream()
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0);
    }
}
