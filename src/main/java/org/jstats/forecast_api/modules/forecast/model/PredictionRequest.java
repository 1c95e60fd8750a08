package org.jstats.forecast_api.modules.forecast.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.jstats.forecast_api.modules.prediction.model.MatchInput;
import org.jstats.forecast_api.modules.prediction.model.PredictionContext;

public record PredictionRequest(
        @NotNull @Valid MatchInput match,
        PredictionContext context
) {}
