package org.jstats.forecast_api.modules.calibration.service;

import org.jstats.forecast_api.modules.calibration.model.AlgorithmPerformanceWindow;
import org.jstats.forecast_api.modules.calibration.model.CalibrationConfig;
import org.jstats.forecast_api.modules.prediction.model.PredictionStatus;
import org.jstats.forecast_api.modules.prediction.model.StoredPrediction;
import org.jstats.forecast_api.modules.prediction.service.AlgorithmRegistry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds per-algorithm performance windows from settled predictions and judges them.
 * Only won and lost predictions count as bets; void (skipped) ones are ignored.
 */
@Component
public class PerformanceAnalyzer {

    private static final int RECENT_RESULTS = 10;

    private static final Comparator<StoredPrediction> NEWEST_FIRST =
            Comparator.comparing(StoredPrediction::generatedAt).reversed()
                    .thenComparing(Comparator.comparingLong(StoredPrediction::id).reversed());

    private final AlgorithmRegistry registry;

    public PerformanceAnalyzer(AlgorithmRegistry registry) {
        this.registry = registry;
    }

    /**
     * One window per registered algorithm, plus any other algorithm found in the records.
     */
    public List<AlgorithmPerformanceWindow> analyzeAll(List<StoredPrediction> records, CalibrationConfig config) {
        Map<String, List<StoredPrediction>> byAlgorithm = new LinkedHashMap<>();
        registry.ids().forEach(id -> byAlgorithm.put(id, new ArrayList<>()));
        for (StoredPrediction record : records) {
            byAlgorithm.computeIfAbsent(record.algorithmId(), id -> new ArrayList<>()).add(record);
        }
        List<AlgorithmPerformanceWindow> windows = new ArrayList<>(byAlgorithm.size());
        byAlgorithm.forEach((id, list) -> windows.add(analyze(id, registry.nameOf(id), list, config)));
        return windows;
    }

    public AlgorithmPerformanceWindow analyze(String algorithmId, String algorithmName,
                                              List<StoredPrediction> records, CalibrationConfig config) {
        List<StoredPrediction> decided = records.stream()
                .filter(r -> r.status().isDecided())
                .sorted(NEWEST_FIRST)
                .toList();
        int wins = (int) decided.stream().filter(StoredPrediction::won).count();
        int losses = decided.size() - wins;
        int totalBets = decided.size();

        double winRate = totalBets > 0 ? (double) wins / totalBets * 100 : 0;
        double expectedWinRate = decided.isEmpty()
                ? 50
                : decided.stream().mapToDouble(StoredPrediction::confidence).average().orElse(50);
        double performanceVsExpected = winRate - expectedWinRate;
        double avgConfidence = records.stream().mapToDouble(StoredPrediction::confidence).average().orElse(0);

        List<String> recent = decided.stream()
                .limit(RECENT_RESULTS)
                .map(r -> r.won() ? "W" : "L")
                .toList();

        boolean enough = totalBets >= config.minBets();
        return new AlgorithmPerformanceWindow(
                algorithmId,
                algorithmName,
                config.windowDays(),
                totalBets,
                wins,
                losses,
                winRate,
                expectedWinRate,
                performanceVsExpected,
                enough && performanceVsExpected < -config.underperformanceThreshold(),
                enough && performanceVsExpected > config.overperformanceThreshold(),
                streak(decided),
                avgConfidence,
                recent);
    }

    /**
     * Severe and sustained underperformance: far below expectation on a real sample,
     * a long losing run, or a very low win rate.
     */
    public static boolean shouldPause(AlgorithmPerformanceWindow window) {
        if (window.totalBets() >= 15 && window.performanceVsExpected() < -20) {
            return true;
        }
        if (window.streak() <= -8) {
            return true;
        }
        return window.totalBets() >= 20 && window.winRate() < 35;
    }

    public static int healthScore(AlgorithmPerformanceWindow window) {
        double score = 50;
        if (window.totalBets() >= 5) {
            score += (window.winRate() - 50) / 50 * 25;
        }
        score += window.performanceVsExpected() / 20 * 15;
        score += Math.max(-10, Math.min(10, window.streak() * 2));
        return (int) Math.max(0, Math.min(100, Math.round(score)));
    }

    // decided must be newest first
    static int streak(List<StoredPrediction> decided) {
        if (decided.isEmpty()) {
            return 0;
        }
        PredictionStatus first = decided.get(0).status();
        int run = 0;
        for (StoredPrediction record : decided) {
            if (record.status() != first) {
                break;
            }
            run++;
        }
        return first == PredictionStatus.WON ? run : -run;
    }
}
