package org.jstats.forecast_api.modules.ensemble.service;

import org.jstats.forecast_api.modules.ensemble.model.PatternType;
import org.jstats.forecast_api.modules.ensemble.model.SequentialPattern;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reads the order of a team's recent results, not just their count.
 * <p>
 * Results are encoded W=1, L=-1, D=0, most recent first. Rules are tried in order
 * (streak, alternating, regression, breakout) and the first match wins.
 */
@Component
public class SequentialPatternDetector {

    static final int MIN_LENGTH = 3;
    private static final int MIN_STREAK = 4;
    private static final double MAX_STREAK_ADJUSTMENT = 8;

    public SequentialPattern detect(List<String> recentForm, double decayRate) {
        if (recentForm == null || recentForm.size() < MIN_LENGTH) {
            return SequentialPattern.none("Insufficient data");
        }
        int[] encoded = encode(recentForm);
        int n = encoded.length;

        int streakLength = 1;
        while (streakLength < n && encoded[streakLength] == encoded[0]) {
            streakLength++;
        }
        double streakStrength = Math.min(1, streakLength / 6.0);

        int flips = 0;
        for (int i = 1; i < n; i++) {
            if (encoded[i] != encoded[i - 1] && encoded[i] != 0 && encoded[i - 1] != 0) {
                flips++;
            }
        }
        double alternatingRatio = (double) flips / (n - 1);

        int half = n / 2;
        double firstAvg = mean(encoded, 0, half);
        double secondAvg = mean(encoded, half, n);
        double regressionSignal = Math.abs(firstAvg - secondAvg);

        double recentAvg = mean(encoded, 0, MIN_LENGTH);
        int olderCount = n - MIN_LENGTH;
        double olderAvg = olderCount > 0 ? mean(encoded, MIN_LENGTH, n) : 0;
        double breakoutSignal = recentAvg - olderAvg;

        if (streakLength >= MIN_STREAK && streakStrength > 0.5) {
            // Streaks regress, so the adjustment is damped rather than extrapolated.
            // Anything but a win streak, draws included, leans negative.
            int direction = encoded[0] == 1 ? 1 : -1;
            double adjustment = direction * streakStrength * 3 * decayRate;
            return new SequentialPattern(
                    PatternType.STREAK,
                    streakStrength,
                    Math.max(-MAX_STREAK_ADJUSTMENT, Math.min(MAX_STREAK_ADJUSTMENT, adjustment)),
                    streakLength + "-game " + label(encoded[0]) + " streak (dampened for regression)");
        }

        if (alternatingRatio > 0.7) {
            return new SequentialPattern(
                    PatternType.ALTERNATING,
                    alternatingRatio,
                    -encoded[0] * 2.0,
                    "Alternating pattern detected (" + Math.round(alternatingRatio * 100) + "% alternation rate)");
        }

        if (regressionSignal > 0.6 && firstAvg * secondAvg < 0) {
            return new SequentialPattern(
                    PatternType.REGRESSION,
                    regressionSignal,
                    -secondAvg * 3,
                    "Regression to mean: reversing from " + (secondAvg > 0 ? "hot" : "cold") + " streak");
        }

        if (Math.abs(breakoutSignal) > 0.5 && olderCount >= 2) {
            return new SequentialPattern(
                    PatternType.BREAKOUT,
                    Math.abs(breakoutSignal),
                    breakoutSignal * 4,
                    "Breakout " + (breakoutSignal > 0 ? "upward" : "downward") + ": recent form diverging from baseline");
        }

        return SequentialPattern.none("No strong sequential pattern");
    }

    static int[] encode(List<String> form) {
        int[] encoded = new int[form.size()];
        for (int i = 0; i < encoded.length; i++) {
            String result = form.get(i);
            if ("W".equalsIgnoreCase(result)) {
                encoded[i] = 1;
            } else if ("L".equalsIgnoreCase(result)) {
                encoded[i] = -1;
            }
        }
        return encoded;
    }

    private static double mean(int[] values, int from, int to) {
        if (to <= from) {
            return 0;
        }
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    private static String label(int encoded) {
        return switch (encoded) {
            case 1 -> "win";
            case -1 -> "loss";
            default -> "draw";
        };
    }
}
