package org.jstats.forecast_api.modules.prediction.service;

import org.jstats.forecast_api.modules.prediction.model.StrengthMetrics;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.jstats.forecast_api.modules.prediction.PredictionFixtures.team;
import static org.junit.jupiter.api.Assertions.*;

class TeamStrengthCalculatorTests {

    private final TeamStrengthCalculator calculator = new TeamStrengthCalculator();

    @Test
    void noRecordNoForm_isNeutral() {
        StrengthMetrics metrics = calculator.calculate(team("t", null));
        assertEquals(StrengthMetrics.neutral(), metrics);
    }

    @Test
    void winningRecord_liftsOffenseAndDefenseEqually() {
        StrengthMetrics metrics = calculator.calculate(team("t", "12-4"));
        assertEquals(60, metrics.offense(), 1e-9);
        assertEquals(60, metrics.defense(), 1e-9);
        assertEquals(50, metrics.momentum(), 1e-9);
        assertEquals(170.0 / 3, metrics.overall(), 1e-9);
    }

    @Test
    void recentResultsWeighMoreThanOlderOnes() {
        // weights 3,2,1 -> 5/6 weighted win share
        StrengthMetrics winsFirst = calculator.calculate(team("t", null, "W", "W", "L"));
        StrengthMetrics lossFirst = calculator.calculate(team("t", null, "L", "W", "W"));

        assertEquals(50 + (5.0 / 6 - 0.5) * 50, winsFirst.momentum(), 1e-9);
        assertTrue(winsFirst.momentum() > lossFirst.momentum());
    }

    @Test
    void unreadableRecord_leavesMetricsNeutral() {
        assertNull(TeamStrengthCalculator.recordWinPct("abc"));
        assertNull(TeamStrengthCalculator.recordWinPct("0-0"));
        assertNull(TeamStrengthCalculator.recordWinPct("7"));
        assertEquals(50, calculator.calculate(team("t", "x-y")).offense(), 1e-9);
    }

    @Test
    void recordWithDraws_ignoresDrawColumn() {
        assertEquals(0.75, TeamStrengthCalculator.recordWinPct("9-3-4"), 1e-9);
    }

    @Test
    void metricsStayWithinBounds() {
        StrengthMetrics best = calculator.calculate(team("t", "40-0", "W", "W", "W", "W", "W"));
        StrengthMetrics worst = calculator.calculate(team("t", "0-40", "L", "L", "L", "L", "L"));

        assertTrue(best.offense() <= 95 && best.momentum() <= 95);
        assertTrue(worst.offense() >= 25 && worst.momentum() >= 20);
        assertEquals(75, best.momentum(), 1e-9);
        assertEquals(25, worst.momentum(), 1e-9);
    }

    @Test
    void drawsCountAsNonWinsInForm() {
        assertEquals(0.0, TeamStrengthCalculator.weightedFormWinPct(List.of("D", "D")), 1e-9);
        assertNull(TeamStrengthCalculator.weightedFormWinPct(List.of()));
    }
}
