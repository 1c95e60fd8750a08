package org.jstats.forecast_api.modules.prediction.service;

/**
 * Expected value and Kelly sizing for a single decimal-odds wager.
 *
 * <pre>
 *   b = odds - 1, q = 1 - p
 *   EV        = p*b - q
 *   fullKelly = (b*p - q) / b
 * </pre>
 * Both are zero when {@code p} is outside (0,1) or the odds are not above 1.
 */
public final class WagerMath {

    public static final double QUARTER_KELLY = 0.25;
    private static final double BANKROLL_UNITS = 100;

    public record ExpectedValue(double expectedValue, double evPercentage) {
        public static final ExpectedValue ZERO = new ExpectedValue(0, 0);
    }

    public record KellyStake(double kellyFraction, double kellyStakeUnits) {
        public static final KellyStake ZERO = new KellyStake(0, 0);
    }

    private WagerMath() {}

    public static boolean isValid(double probability, double decimalOdds) {
        return probability > 0 && probability < 1 && decimalOdds > 1
                && Double.isFinite(probability) && Double.isFinite(decimalOdds);
    }

    public static ExpectedValue expectedValue(double probability, double decimalOdds) {
        if (!isValid(probability, decimalOdds)) {
            return ExpectedValue.ZERO;
        }
        double b = decimalOdds - 1;
        double ev = probability * b - (1 - probability);
        return new ExpectedValue(round(ev, 4), round(ev * 100, 2));
    }

    public static KellyStake kelly(double probability, double decimalOdds) {
        return kelly(probability, decimalOdds, QUARTER_KELLY);
    }

    public static KellyStake kelly(double probability, double decimalOdds, double fraction) {
        if (!isValid(probability, decimalOdds)) {
            return KellyStake.ZERO;
        }
        double b = decimalOdds - 1;
        double fullKelly = (b * probability - (1 - probability)) / b;
        double applied = Math.max(0, fullKelly * fraction);
        return new KellyStake(round(applied, 4), round(applied * BANKROLL_UNITS, 2));
    }

    public static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }
}
