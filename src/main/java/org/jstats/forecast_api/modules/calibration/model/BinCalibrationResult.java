package org.jstats.forecast_api.modules.calibration.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

public record BinCalibrationResult(
        List<CalibrationBin> bins,
        double overallAdjustmentFactor,
        boolean calibrated,
        List<BinRecommendation> recommendations
) {
    public BinCalibrationResult {
        bins = List.copyOf(bins);
        recommendations = List.copyOf(recommendations);
    }

    public record BinRecommendation(String bin, Issue issue, double adjustmentApplied, String description) {}

    public enum Issue {
        OVERCONFIDENT,
        UNDERCONFIDENT,
        LOW_SAMPLE,
        WELL_CALIBRATED;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * @param wasAdjusted whether the bin's factor differs from 1
     */
    public record CalibratedConfidence(double calibratedConfidence, double adjustmentFactor, String binLabel,
                                       boolean wasAdjusted) {}
}
