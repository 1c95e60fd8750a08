package org.jstats.forecast_api.modules.calibration.model;

import java.util.List;

/**
 * Rolling performance of one algorithm over its settled predictions.
 *
 * @param winRate               wins / decided bets * 100, 0 without bets
 * @param expectedWinRate       mean stated confidence of the settled predictions, 50 without any
 * @param performanceVsExpected {@code winRate - expectedWinRate}
 * @param streak                signed run length of the most recent results, positive for wins
 * @param recentResults         up to ten most recent decided results, W or L, newest first
 */
public record AlgorithmPerformanceWindow(
        String algorithmId,
        String algorithmName,
        int windowDays,
        int totalBets,
        int wins,
        int losses,
        double winRate,
        double expectedWinRate,
        double performanceVsExpected,
        boolean underperforming,
        boolean overperforming,
        int streak,
        double avgConfidence,
        List<String> recentResults
) {
    public AlgorithmPerformanceWindow {
        recentResults = recentResults == null ? List.of() : List.copyOf(recentResults);
    }
}
