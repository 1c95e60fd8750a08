package org.jstats.forecast_api.modules.consensus.service;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.jspecify.annotations.NullMarked;
import org.jstats.forecast_api.modules.consensus.model.AlgorithmStats;
import org.jstats.forecast_api.modules.consensus.model.AlgorithmWeight;
import org.jstats.forecast_api.modules.consensus.repository.AlgorithmStatsRepository;
import org.jstats.forecast_api.modules.prediction.service.AlgorithmDefinition;
import org.jstats.forecast_api.modules.prediction.service.AlgorithmRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns stored per-algorithm accuracy into normalized trust weights.
 * <p>
 * Win rates are shrunk toward 50 until an algorithm has {@value #FULL_RELIABILITY_SAMPLES}
 * settled predictions, and algorithms whose win rate tracks their stated confidence get
 * a calibration bonus. Without usable history every algorithm gets an equal share.
 */
@Service
@NullMarked
public class WeightEngine {

    private static final Logger log = LoggerFactory.getLogger(WeightEngine.class);

    static final int FULL_RELIABILITY_SAMPLES = 30;
    private static final double BASELINE_WIN_RATE = 50;

    private final AlgorithmStatsRepository statsRepository;
    private final AlgorithmRegistry registry;

    public WeightEngine(AlgorithmStatsRepository statsRepository, AlgorithmRegistry registry) {
        this.statsRepository = statsRepository;
        this.registry = registry;
    }

    /**
     * Current weights, never throwing; any read failure yields {@link #defaultWeights()}.
     */
    @CircuitBreaker(name = "algorithmStats", fallbackMethod = "fetchWeightsFallback")
    public List<AlgorithmWeight> fetchWeights() {
        List<AlgorithmStats> stats;
        try {
            stats = statsRepository.findAll();
        } catch (RuntimeException e) {
            if (log.isWarnEnabled()) {
                log.warn("Reading algorithm stats failed, using equal weights: {}", e.getMessage());
            }
            return defaultWeights();
        }
        if (stats.isEmpty()) {
            log.debug("No algorithm stats stored yet, using equal weights");
            return defaultWeights();
        }
        return computeWeights(stats);
    }

    List<AlgorithmWeight> computeWeights(List<AlgorithmStats> stats) {
        int n = stats.size();
        double[] raw = new double[n];
        double total = 0;
        for (int i = 0; i < n; i++) {
            AlgorithmStats s = stats.get(i);
            double winRate = s.winRateOrDefault();
            double reliability = reliability(s.totalPredictionsOrDefault());
            double shrunkWinRate = reliability * winRate + (1 - reliability) * BASELINE_WIN_RATE;
            double calibrationBonus = Math.max(0, 1 - Math.abs(winRate - s.avgConfidenceOrDefault()) / 50);
            raw[i] = (shrunkWinRate / 100) * (0.7 + 0.3 * calibrationBonus);
            total += raw[i];
        }

        List<AlgorithmWeight> weights = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            AlgorithmStats s = stats.get(i);
            double weight = total > 0 ? raw[i] / total : 1.0 / n;
            weights.add(new AlgorithmWeight(
                    s.algorithmId(),
                    registry.nameOf(s.algorithmId()),
                    weight,
                    s.winRateOrDefault(),
                    s.totalPredictionsOrDefault(),
                    s.avgConfidenceOrDefault(),
                    reliability(s.totalPredictionsOrDefault())));
        }
        return weights;
    }

    /**
     * Equal split across the registered algorithms, reliability 0.
     */
    public List<AlgorithmWeight> defaultWeights() {
        List<AlgorithmDefinition> algorithms = registry.all();
        double share = 1.0 / algorithms.size();
        return algorithms.stream()
                .map(a -> new AlgorithmWeight(a.id(), a.name(), share, BASELINE_WIN_RATE, 0, BASELINE_WIN_RATE, 0))
                .toList();
    }

    static double reliability(int totalPredictions) {
        return Math.min(1.0, (double) totalPredictions / FULL_RELIABILITY_SAMPLES);
    }

    private List<AlgorithmWeight> fetchWeightsFallback(Throwable ex) {
        if (log.isWarnEnabled()) {
            log.warn("Weight lookup short-circuited, using equal weights: {}", ex.getMessage());
        }
        return defaultWeights();
    }
}
