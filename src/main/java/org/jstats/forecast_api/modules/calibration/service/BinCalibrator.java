package org.jstats.forecast_api.modules.calibration.service;

import org.jstats.forecast_api.modules.calibration.model.BinCalibrationResult;
import org.jstats.forecast_api.modules.calibration.model.BinCalibrationResult.BinRecommendation;
import org.jstats.forecast_api.modules.calibration.model.BinCalibrationResult.CalibratedConfidence;
import org.jstats.forecast_api.modules.calibration.model.BinCalibrationResult.Issue;
import org.jstats.forecast_api.modules.calibration.model.CalibrationBin;
import org.jstats.forecast_api.modules.prediction.model.StoredPrediction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.jstats.forecast_api.modules.prediction.service.WagerMath.round;

/**
 * Confidence-range calibration: splits decided predictions into 5-point bins from
 * 50 to 99 and derives a damped correction factor for bins whose realized win
 * rate strays from the bin midpoint.
 * <p>
 * Results are plain values; callers hand them back to {@link #apply} explicitly.
 */
@Component
public class BinCalibrator {

    static final int FIRST_BIN = 50;
    static final int LAST_BIN = 95;
    static final int BIN_WIDTH = 5;
    private static final int FLAG_SAMPLES = 3;
    private static final int ADJUST_SAMPLES = 5;
    private static final double ERROR_TOLERANCE = 5;

    public BinCalibrationResult analyze(List<StoredPrediction> predictions) {
        int binCount = (LAST_BIN - FIRST_BIN) / BIN_WIDTH + 1;
        int[] totals = new int[binCount];
        int[] wins = new int[binCount];
        for (StoredPrediction p : predictions) {
            if (!p.status().isDecided()) {
                continue;
            }
            int idx = binIndex(p.confidence());
            if (idx < 0 || idx >= binCount) {
                continue;
            }
            totals[idx]++;
            if (p.won()) {
                wins[idx]++;
            }
        }

        List<CalibrationBin> bins = new ArrayList<>(binCount);
        List<BinRecommendation> recommendations = new ArrayList<>();
        for (int i = 0; i < binCount; i++) {
            int min = FIRST_BIN + i * BIN_WIDTH;
            int max = min + BIN_WIDTH - 1;
            String label = min + "-" + max + "%";
            double expected = (min + max) / 2.0;
            int total = totals[i];
            double actual = total > 0 ? (double) wins[i] / total * 100 : expected;
            double error = actual - expected;

            boolean overconfident = error < -ERROR_TOLERANCE && total >= FLAG_SAMPLES;
            boolean underconfident = error > ERROR_TOLERANCE && total >= FLAG_SAMPLES;
            double factor = 1.0;
            if (total >= ADJUST_SAMPLES) {
                if (overconfident) {
                    double target = Math.max(0.7, actual / expected);
                    factor = 0.7 + (target - 0.7) * 0.8;
                } else if (underconfident) {
                    double target = Math.min(1.15, actual / expected);
                    factor = 1.0 + (target - 1.0) * 0.5;
                }
            }

            bins.add(new CalibrationBin(min, max, label, round(actual, 1), expected, round(error, 1), total,
                    round(factor, 2), overconfident, underconfident));

            if (total > 0 && total < ADJUST_SAMPLES) {
                recommendations.add(new BinRecommendation(label, Issue.LOW_SAMPLE, 1.0,
                        "Only " + total + " predictions - need more data for reliable calibration"));
            } else if (overconfident) {
                recommendations.add(new BinRecommendation(label, Issue.OVERCONFIDENT, factor,
                        String.format(Locale.ROOT, "Reducing confidence by %.0f%% (actual: %.1f%% vs expected: %.1f%%)",
                                (1 - factor) * 100, actual, expected)));
            } else if (underconfident) {
                recommendations.add(new BinRecommendation(label, Issue.UNDERCONFIDENT, factor,
                        String.format(Locale.ROOT, "Boosting confidence by %.0f%% (actual: %.1f%% vs expected: %.1f%%)",
                                (factor - 1) * 100, actual, expected)));
            } else if (total >= ADJUST_SAMPLES) {
                recommendations.add(new BinRecommendation(label, Issue.WELL_CALIBRATED, 1.0,
                        String.format(Locale.ROOT, "Well calibrated (%.1f%% actual, %d picks)", actual, total)));
            }
        }

        double weighted = 0;
        int samples = 0;
        for (CalibrationBin bin : bins) {
            if (bin.sampleSize() >= FLAG_SAMPLES) {
                weighted += bin.adjustmentFactor() * bin.sampleSize();
                samples += bin.sampleSize();
            }
        }
        double overall = samples > 0 ? weighted / samples : 1.0;
        long problemBins = bins.stream()
                .filter(b -> (b.overconfident() || b.underconfident()) && b.sampleSize() >= ADJUST_SAMPLES)
                .count();
        boolean calibrated = problemBins <= Math.ceil(bins.size() * 0.3);

        return new BinCalibrationResult(bins, round(overall, 2), calibrated, recommendations);
    }

    /**
     * Scales a raw confidence by its bin's factor; out-of-range values use the nearest bin.
     */
    public CalibratedConfidence apply(double rawConfidence, BinCalibrationResult calibration) {
        List<CalibrationBin> bins = calibration.bins();
        if (bins.isEmpty()) {
            return new CalibratedConfidence(rawConfidence, 1.0, "N/A", false);
        }
        int idx = Math.max(0, Math.min(binIndex(rawConfidence), bins.size() - 1));
        CalibrationBin bin = bins.get(idx);
        double calibrated = Math.max(45, Math.min(95, rawConfidence * bin.adjustmentFactor()));
        return new CalibratedConfidence(round(calibrated, 1), bin.adjustmentFactor(), bin.label(),
                bin.adjustmentFactor() != 1.0);
    }

    static int binIndex(double confidence) {
        return (int) Math.floor((confidence - FIRST_BIN) / BIN_WIDTH);
    }
}
