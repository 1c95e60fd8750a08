package org.jstats.forecast_api.modules.prediction.model;

/**
 * Bookmaker prices in decimal odds. Any price may be absent.
 */
public record OddsSnapshot(
        Double homeWin,
        Double awayWin,
        Double draw,
        Spread spread,
        Total total
) {
    public record Spread(double home, double away, double homeOdds, double awayOdds) {}

    public record Total(double line, double overOdds, double underOdds) {}

    /**
     * Price for the given side, or null when the book has none.
     */
    public Double priceFor(Recommendation side) {
        return switch (side) {
            case HOME -> homeWin;
            case AWAY -> awayWin;
            case DRAW -> draw;
            case SKIP -> null;
        };
    }
}
