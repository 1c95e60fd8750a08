package org.jstats.forecast_api.modules.calibration.model;

import java.util.List;

public record CalibrationOutcome(
        List<ModelWeight> weights,
        List<RecalibrationAction> actions,
        List<RecalibrationRecommendation> recommendations
) {
    public CalibrationOutcome {
        weights = List.copyOf(weights);
        actions = List.copyOf(actions);
        recommendations = List.copyOf(recommendations);
    }
}
