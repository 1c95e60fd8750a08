package org.jstats.forecast_api.modules.forecast.controller;

import org.jstats.forecast_api.core.config.ProblemHandler;
import org.jstats.forecast_api.modules.consensus.model.AlgorithmWeight;
import org.jstats.forecast_api.modules.forecast.service.ForecastService;
import org.jstats.forecast_api.modules.prediction.model.FinalScore;
import org.jstats.forecast_api.modules.prediction.model.MatchInput;
import org.jstats.forecast_api.modules.prediction.model.Recommendation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.jstats.forecast_api.modules.prediction.PredictionFixtures.prediction;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class ForecastControllerTests {

    private static final String MATCH = """
            {
              "match": {
                "id": "m1",
                "league": "NBA",
                "homeTeam": {"id": "bos", "name": "Boston", "record": "15-5", "recentForm": ["W", "W", "L"]},
                "awayTeam": {"id": "nyk", "name": "New York", "record": "9-11"}
              }
            }
            """;

    ForecastService forecastService;
    MockMvc mvc;

    @BeforeEach
    void setUp() {
        forecastService = mock(ForecastService.class);
        mvc = MockMvcBuilders.standaloneSetup(new ForecastController(forecastService))
                .setControllerAdvice(new ProblemHandler())
                .build();
    }

    @Test
    void predictions_returnsOneResultPerAlgorithm() throws Exception {
        when(forecastService.predict(any(), any())).thenReturn(List.of(
                prediction("alg-a", Recommendation.HOME, 68),
                prediction("alg-b", Recommendation.SKIP, 41)));

        mvc.perform(post("/api/forecast/predictions").contentType(MediaType.APPLICATION_JSON).content(MATCH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].algorithmId").value("alg-a"))
                .andExpect(jsonPath("$[0].recommendation").value("home"))
                .andExpect(jsonPath("$[1].recommendation").value("skip"));

        ArgumentCaptor<MatchInput> match = ArgumentCaptor.forClass(MatchInput.class);
        verify(forecastService).predict(match.capture(), isNull());
        assertEquals("bos", match.getValue().homeTeam().id());
        assertEquals(List.of("W", "W", "L"), match.getValue().homeTeam().recentForm());
        assertTrue(match.getValue().awayTeam().recentForm().isEmpty());
    }

    @Test
    void nullFormEntries_areDropped() throws Exception {
        when(forecastService.predict(any(), any())).thenReturn(List.of());
        String body = MATCH.replace("[\"W\", \"W\", \"L\"]", "[\"W\", null, \"L\"]");

        mvc.perform(post("/api/forecast/predictions").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk());

        ArgumentCaptor<MatchInput> match = ArgumentCaptor.forClass(MatchInput.class);
        verify(forecastService).predict(match.capture(), isNull());
        assertEquals(List.of("W", "L"), match.getValue().homeTeam().recentForm());
    }

    @Test
    void malformedBody_isRejectedAsProblem() throws Exception {
        mvc.perform(post("/api/forecast/predictions").contentType(MediaType.APPLICATION_JSON).content("{\"match\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Invalid Request Body"));

        verifyNoInteractions(forecastService);
    }

    @Test
    void missingMatch_isRejectedAsProblem() throws Exception {
        mvc.perform(post("/api/forecast/predictions").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Invalid Request Body"))
                .andExpect(jsonPath("$.detail").value(containsString("match")));

        verifyNoInteractions(forecastService);
    }

    @Test
    void teamWithoutId_isRejected() throws Exception {
        String body = MATCH.replace("\"id\": \"bos\", ", "");

        mvc.perform(post("/api/forecast").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value(containsString("match.homeTeam.id")));
    }

    @Test
    void emptyBatch_isRejected() throws Exception {
        mvc.perform(post("/api/forecast/predictions/batch").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"matches\": []}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void negativeScore_isRejected() throws Exception {
        String body = """
                {"homeTeamId": "bos", "awayTeamId": "nyk", "league": "NBA", "homeScore": -1, "awayScore": 99}
                """;

        mvc.perform(post("/api/forecast/matches/m1/result").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Invalid Request Body"));
    }

    @Test
    void result_settlesTheMatch() throws Exception {
        when(forecastService.recordResult(eq("m1"), any())).thenReturn(List.of());
        String body = """
                {"homeTeamId": "bos", "awayTeamId": "nyk", "league": "NBA", "homeScore": 101, "awayScore": 99}
                """;

        mvc.perform(post("/api/forecast/matches/m1/result").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        verify(forecastService).recordResult("m1", new FinalScore("bos", "nyk", "NBA", 101, 99));
    }

    @Test
    void weights_listsCurrentWeights() throws Exception {
        when(forecastService.weights()).thenReturn(List.of(
                new AlgorithmWeight("alg-a", "A", 0.6, 58, 40, 61, 0.8),
                new AlgorithmWeight("alg-b", "B", 0.4, 50, 0, 50, 0)));

        mvc.perform(get("/api/forecast/weights"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].algorithmId").value("alg-a"))
                .andExpect(jsonPath("$[0].weight").value(0.6))
                .andExpect(jsonPath("$[1].reliability").value(0.0));
    }

    @Test
    void unexpectedFailure_becomesInternalServerError() throws Exception {
        when(forecastService.weights()).thenThrow(new IllegalStateException("boom"));

        mvc.perform(get("/api/forecast/weights"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.title").value("Internal Server Error"));
    }
}
