package org.jstats.forecast_api.modules.calibration.model;

import java.time.Instant;
import java.util.List;

/**
 * Everything one calibration pass computed and stored.
 */
public record CalibrationRun(
        Instant ranAt,
        int settledPredictions,
        List<AlgorithmPerformanceWindow> windows,
        CalibrationOutcome outcome,
        BinCalibrationResult bins
) {
    public CalibrationRun {
        windows = List.copyOf(windows);
    }
}
