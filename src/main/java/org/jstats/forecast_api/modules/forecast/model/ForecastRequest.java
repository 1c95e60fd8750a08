package org.jstats.forecast_api.modules.forecast.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.jstats.forecast_api.modules.prediction.model.MatchInput;
import org.jstats.forecast_api.modules.prediction.model.PredictionContext;

/**
 * @param simulate run the Monte Carlo uncertainty pass as well
 * @param seed     fixes the Monte Carlo random source for reproducible output
 */
public record ForecastRequest(
        @NotNull @Valid MatchInput match,
        PredictionContext context,
        boolean simulate,
        Long seed
) {}
