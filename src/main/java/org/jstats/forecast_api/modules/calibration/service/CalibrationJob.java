package org.jstats.forecast_api.modules.calibration.service;

import org.jspecify.annotations.NullMarked;
import org.jstats.forecast_api.modules.calibration.model.AlgorithmPerformanceWindow;
import org.jstats.forecast_api.modules.calibration.model.BinCalibrationResult;
import org.jstats.forecast_api.modules.calibration.model.CalibrationConfig;
import org.jstats.forecast_api.modules.calibration.model.CalibrationOutcome;
import org.jstats.forecast_api.modules.calibration.model.CalibrationRun;
import org.jstats.forecast_api.modules.calibration.repository.BinCalibrationRepository;
import org.jstats.forecast_api.modules.calibration.repository.ModelWeightRepository;
import org.jstats.forecast_api.modules.consensus.model.AlgorithmStats;
import org.jstats.forecast_api.modules.consensus.repository.AlgorithmStatsRepository;
import org.jstats.forecast_api.modules.prediction.model.StoredPrediction;
import org.jstats.forecast_api.modules.prediction.repository.PredictionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The periodic half of the feedback loop. Reads settled predictions from the window,
 * recalibrates, then writes model weights and confidence bins and refreshes the stats the weight engine reads.
 * Prediction requests pick the new values up on their next read.
 */
@Service
@NullMarked
public class CalibrationJob {

    private static final Logger log = LoggerFactory.getLogger(CalibrationJob.class);

    private final PredictionRepository predictionRepository;
    private final ModelWeightRepository modelWeightRepository;
    private final BinCalibrationRepository binCalibrationRepository;
    private final AlgorithmStatsRepository statsRepository;
    private final PerformanceAnalyzer analyzer;
    private final ModelCalibrationService calibrationService;
    private final BinCalibrator binCalibrator;
    private final CalibrationConfig config;
    private final Clock clock;

    // Scheduled and manual runs must not interleave their writes
    private final ReentrantLock running = new ReentrantLock();

    public CalibrationJob(
            PredictionRepository predictionRepository,
            ModelWeightRepository modelWeightRepository,
            BinCalibrationRepository binCalibrationRepository,
            AlgorithmStatsRepository statsRepository,
            PerformanceAnalyzer analyzer,
            ModelCalibrationService calibrationService,
            BinCalibrator binCalibrator,
            CalibrationConfig config,
            Clock clock) {
        this.predictionRepository = predictionRepository;
        this.modelWeightRepository = modelWeightRepository;
        this.binCalibrationRepository = binCalibrationRepository;
        this.statsRepository = statsRepository;
        this.analyzer = analyzer;
        this.calibrationService = calibrationService;
        this.binCalibrator = binCalibrator;
        this.config = config;
        this.clock = clock;
    }

    @Scheduled(cron = "${forecast.calibration.cron:0 15 * * * *}")
    public void scheduledRun() {
        try {
            run();
        } catch (RuntimeException e) {
            if (log.isErrorEnabled()) {
                log.error("Scheduled calibration failed: {}", e.getMessage(), e);
            }
        }
    }

    public CalibrationRun run() {
        running.lock();
        try {
            Instant now = clock.instant();
            Instant since = now.minus(Duration.ofDays(config.windowDays()));
            List<StoredPrediction> settled = predictionRepository.findSettledSince(since);

            List<AlgorithmPerformanceWindow> windows = analyzer.analyzeAll(settled, config);
            CalibrationOutcome outcome = calibrationService.calculateModelWeights(windows, config);
            BinCalibrationResult bins = binCalibrator.analyze(settled);

            modelWeightRepository.saveAll(outcome.weights());
            binCalibrationRepository.save(bins, now);
            for (AlgorithmPerformanceWindow window : windows) {
                statsRepository.upsert(toStats(window), now);
            }

            if (log.isInfoEnabled()) {
                log.info("Calibration over {} settled predictions since {}: {} weights, bins calibrated={} (overall factor {})",
                        settled.size(), since, outcome.weights().size(), bins.calibrated(), bins.overallAdjustmentFactor());
            }
            return new CalibrationRun(now, settled.size(), windows, outcome, bins);
        } finally {
            running.unlock();
        }
    }

    // No bets yet stores null rates so readers fall back to the 50 baseline
    static AlgorithmStats toStats(AlgorithmPerformanceWindow window) {
        boolean hasBets = window.totalBets() > 0;
        return new AlgorithmStats(
                window.algorithmId(),
                hasBets ? window.winRate() : null,
                window.totalBets(),
                window.wins(),
                hasBets ? window.expectedWinRate() : null);
    }
}
