package org.jstats.forecast_api.modules.ensemble.service;

import org.jstats.forecast_api.modules.prediction.model.PredictionResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * How differently the base predictors see a match, 0-1.
 * Blends confidence spread (40%), recommendation disagreement (35%) and EV spread (25%).
 */
@Component
public class DiversityScorer {

    public double score(List<PredictionResult> predictions) {
        int n = predictions.size();
        if (n < 2) {
            return 0;
        }
        double confidenceDiversity = Math.min(1,
                Math.sqrt(variance(predictions.stream().mapToDouble(PredictionResult::confidence).toArray())) / 15);
        long unique = predictions.stream().map(PredictionResult::recommendation).distinct().count();
        double recommendationDiversity = (double) (unique - 1) / (n - 1);
        double evDiversity = Math.min(1,
                Math.sqrt(variance(predictions.stream().mapToDouble(PredictionResult::evPercentage).toArray())) / 10);

        return confidenceDiversity * 0.4 + recommendationDiversity * 0.35 + evDiversity * 0.25;
    }

    // Population variance
    static double variance(double[] values) {
        double mean = 0;
        for (double v : values) {
            mean += v;
        }
        mean /= values.length;
        double sum = 0;
        for (double v : values) {
            sum += (v - mean) * (v - mean);
        }
        return sum / values.length;
    }
}
