package org.jstats.forecast_api.modules.forecast.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import org.jstats.forecast_api.modules.prediction.model.MatchInput;
import org.jstats.forecast_api.modules.prediction.model.PredictionContext;

import java.util.List;

/**
 * @param context applied to every match in the batch
 */
public record BatchPredictionRequest(
        @NotEmpty @Size(max = 200) List<@Valid MatchInput> matches,
        PredictionContext context
) {}
