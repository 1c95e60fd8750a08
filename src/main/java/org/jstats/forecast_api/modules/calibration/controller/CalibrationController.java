package org.jstats.forecast_api.modules.calibration.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.jstats.forecast_api.modules.calibration.model.CalibrationRun;
import org.jstats.forecast_api.modules.calibration.model.ModelWeight;
import org.jstats.forecast_api.modules.calibration.repository.ModelWeightRepository;
import org.jstats.forecast_api.modules.calibration.service.CalibrationJob;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Tag(name = "Calibration", description = "Performance-driven recalibration of the prediction algorithms")
@RestController
@RequestMapping("/api/calibration")
public class CalibrationController {

    private final CalibrationJob calibrationJob;
    private final ModelWeightRepository modelWeightRepository;

    public CalibrationController(CalibrationJob calibrationJob, ModelWeightRepository modelWeightRepository) {
        this.calibrationJob = calibrationJob;
        this.modelWeightRepository = modelWeightRepository;
    }

    @Operation(
            summary = "Run calibration now",
            description = "Recalibrates every algorithm from the settled predictions in the configured window",
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Calibration completed",
                            content = @Content(
                                    mediaType = "application/json",
                                    schema = @Schema(implementation = CalibrationRun.class)
                            )
                    ),
                    @ApiResponse(
                            responseCode = "500",
                            description = "Storage failure",
                            content = @Content(mediaType = "application/problem+json")
                    )
            }
    )
    @PostMapping("/run")
    public CalibrationRun run() {
        return calibrationJob.run();
    }

    @Operation(summary = "Latest calibrated weight per algorithm")
    @GetMapping("/weights")
    public List<ModelWeight> weights() {
        return modelWeightRepository.findLatest();
    }
}
