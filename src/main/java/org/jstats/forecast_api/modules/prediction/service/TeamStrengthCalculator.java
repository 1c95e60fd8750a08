package org.jstats.forecast_api.modules.prediction.service;

import org.jstats.forecast_api.modules.prediction.model.StrengthMetrics;
import org.jstats.forecast_api.modules.prediction.model.TeamSnapshot;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Scores a team's offense, defense and momentum from its record and recent form.
 * Missing or unparsable inputs leave the affected metric at the neutral 50.
 */
@Component
public class TeamStrengthCalculator {

    private static final double NEUTRAL = 50;
    private static final double RECORD_SCALE = 40;
    private static final double FORM_SCALE = 50;

    public StrengthMetrics calculate(TeamSnapshot team) {
        double offense = NEUTRAL;
        double defense = NEUTRAL;
        double momentum = NEUTRAL;

        Double winPct = recordWinPct(team.record());
        if (winPct != null) {
            double adjustment = (winPct - 0.5) * RECORD_SCALE;
            offense += adjustment;
            defense += adjustment;
        }

        Double weightedWinPct = weightedFormWinPct(team.recentForm());
        if (weightedWinPct != null) {
            momentum += (weightedWinPct - 0.5) * FORM_SCALE;
        }

        return StrengthMetrics.of(
                clamp(offense, 25, 95),
                clamp(defense, 25, 95),
                clamp(momentum, 20, 95));
    }

    /**
     * Win share of a {@code W-L} (or {@code W-L-D}) record string, or null when it cannot be read.
     */
    static Double recordWinPct(String record) {
        if (record == null || record.isBlank()) {
            return null;
        }
        String[] parts = record.trim().split("-");
        if (parts.length < 2) {
            return null;
        }
        try {
            int wins = Integer.parseInt(parts[0].trim());
            int losses = Integer.parseInt(parts[1].trim());
            int total = wins + losses;
            return total > 0 ? (double) wins / total : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Recency weighted win share; the i-th most recent result weighs {@code size - i}.
     */
    static Double weightedFormWinPct(List<String> form) {
        if (form == null || form.isEmpty()) {
            return null;
        }
        int size = form.size();
        double weightedWins = 0;
        double totalWeight = 0;
        for (int i = 0; i < size; i++) {
            double weight = size - i;
            if ("W".equalsIgnoreCase(form.get(i))) {
                weightedWins += weight;
            }
            totalWeight += weight;
        }
        return totalWeight > 0 ? weightedWins / totalWeight : null;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
