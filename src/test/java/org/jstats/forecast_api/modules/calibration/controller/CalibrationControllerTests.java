package org.jstats.forecast_api.modules.calibration.controller;

import org.jstats.forecast_api.core.config.ProblemHandler;
import org.jstats.forecast_api.modules.calibration.model.ModelWeight;
import org.jstats.forecast_api.modules.calibration.repository.ModelWeightRepository;
import org.jstats.forecast_api.modules.calibration.service.CalibrationJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.jstats.forecast_api.modules.prediction.PredictionFixtures.NOW;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class CalibrationControllerTests {

    CalibrationJob calibrationJob;
    ModelWeightRepository modelWeightRepository;
    MockMvc mvc;

    @BeforeEach
    void setUp() {
        calibrationJob = mock(CalibrationJob.class);
        modelWeightRepository = mock(ModelWeightRepository.class);
        mvc = MockMvcBuilders.standaloneSetup(new CalibrationController(calibrationJob, modelWeightRepository))
                .setControllerAdvice(new ProblemHandler())
                .build();
    }

    @Test
    void weights_returnsLatestCalibration() throws Exception {
        when(modelWeightRepository.findLatest()).thenReturn(List.of(
                new ModelWeight("alg-a", "A", 0.34, 0.3, "Reduced: -20.0% below expected", 0.9, 61, NOW)));

        mvc.perform(get("/api/calibration/weights"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].algorithmId").value("alg-a"))
                .andExpect(jsonPath("$[0].confidenceMultiplier").value(0.9))
                .andExpect(jsonPath("$[0].minConfidenceThreshold").value(61.0));
    }

    @Test
    void failedRun_isReportedAsServerError() throws Exception {
        when(calibrationJob.run()).thenThrow(new DataAccessResourceFailureException("db down"));

        mvc.perform(post("/api/calibration/run"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value("Unexpected error. If this persists, contact support."));
    }
}
