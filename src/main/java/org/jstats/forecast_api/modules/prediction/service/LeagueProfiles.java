package org.jstats.forecast_api.modules.prediction.service;

import java.util.Locale;
import java.util.Map;

/**
 * Fixed per-league constants: home advantage in confidence points and the
 * typical points/goals a side scores.
 */
public final class LeagueProfiles {

    private static final String DEFAULT = "DEFAULT";

    private static final Map<String, Double> HOME_ADVANTAGE = Map.of(
            "NBA", 2.5,
            "NFL", 2.8,
            "MLB", 1.5,
            "NHL", 2.2,
            "NCAAB", 3.5,
            "NCAAF", 3.0,
            "SOCCER", 2.0,
            "MLS", 2.2,
            "EPL", 2.0,
            DEFAULT, 2.0
    );

    private static final Map<String, Double> BASE_SCORE = Map.of(
            "NBA", 110.0,
            "NFL", 22.0,
            "MLB", 4.5,
            "NHL", 2.8,
            "NCAAB", 72.0,
            "NCAAF", 24.0,
            "SOCCER", 1.3,
            DEFAULT, 2.0
    );

    private LeagueProfiles() {}

    public static double homeAdvantage(String league) {
        return HOME_ADVANTAGE.getOrDefault(key(league), HOME_ADVANTAGE.get(DEFAULT));
    }

    public static double baseScore(String league) {
        return BASE_SCORE.getOrDefault(key(league), BASE_SCORE.get(DEFAULT));
    }

    private static String key(String league) {
        return league == null ? DEFAULT : league.trim().toUpperCase(Locale.ROOT);
    }
}
