package org.jstats.forecast_api.modules.forecast.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.jstats.forecast_api.modules.consensus.model.AlgorithmWeight;
import org.jstats.forecast_api.modules.forecast.model.BatchPredictionRequest;
import org.jstats.forecast_api.modules.forecast.model.ForecastRequest;
import org.jstats.forecast_api.modules.forecast.model.ForecastResponse;
import org.jstats.forecast_api.modules.forecast.model.PredictionRequest;
import org.jstats.forecast_api.modules.forecast.service.ForecastService;
import org.jstats.forecast_api.modules.prediction.model.FinalScore;
import org.jstats.forecast_api.modules.prediction.model.PredictionResult;
import org.jstats.forecast_api.modules.prediction.model.StoredPrediction;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for match forecasts.
 */
@Tag(name = "Forecasts", description = "Multi-algorithm match forecasts with their consensus")
@Validated
@RestController
@RequestMapping("/api/forecast")
public class ForecastController {

    private final ForecastService forecastService;

    public ForecastController(ForecastService forecastService) {
        this.forecastService = forecastService;
    }

    @Operation(
            summary = "Full forecast for a match",
            description = "Runs every algorithm, fuses them into a weighted consensus, refines it with the ensemble "
                    + "and optionally quantifies uncertainty with a Monte Carlo simulation",
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Forecast generated",
                            content = @Content(
                                    mediaType = "application/json",
                                    schema = @Schema(implementation = ForecastResponse.class)
                            )
                    ),
                    @ApiResponse(
                            responseCode = "400",
                            description = "Invalid request",
                            content = @Content(mediaType = "application/problem+json")
                    )
            }
    )
    @PostMapping
    public ForecastResponse forecast(@RequestBody @Valid ForecastRequest request) {
        return forecastService.forecast(request.match(), request.context(), request.simulate(), request.seed());
    }

    @Operation(summary = "Per-algorithm predictions for a match")
    @PostMapping("/predictions")
    public List<PredictionResult> predict(@RequestBody @Valid PredictionRequest request) {
        return forecastService.predict(request.match(), request.context());
    }

    @Operation(summary = "Per-algorithm predictions for several matches")
    @PostMapping("/predictions/batch")
    public List<PredictionResult> predictBatch(@RequestBody @Valid BatchPredictionRequest request) {
        return forecastService.predictBatch(request.matches(), request.context());
    }

    @Operation(summary = "Current consensus weights per algorithm")
    @GetMapping("/weights")
    public List<AlgorithmWeight> weights() {
        return forecastService.weights();
    }

    @Operation(
            summary = "Record a final score",
            description = "Stores the result and settles every pending prediction for the match"
    )
    @PostMapping("/matches/{matchId}/result")
    public List<StoredPrediction> recordResult(@PathVariable @NotBlank String matchId,
                                               @RequestBody @Valid FinalScore score) {
        return forecastService.recordResult(matchId, score);
    }
}
