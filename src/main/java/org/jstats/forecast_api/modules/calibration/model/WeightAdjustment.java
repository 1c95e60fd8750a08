package org.jstats.forecast_api.modules.calibration.model;

import org.jspecify.annotations.Nullable;
import org.jstats.forecast_api.modules.calibration.model.BinCalibrationResult.CalibratedConfidence;

/**
 * A confidence passed through an algorithm's calibrated multiplier, then its confidence bin,
 * and checked against its threshold.
 *
 * @param binAdjustment the bin step, absent when no bin calibration was available
 */
public record WeightAdjustment(
        double adjustedConfidence,
        boolean meetsThreshold,
        double weight,
        @Nullable CalibratedConfidence binAdjustment
) {}
