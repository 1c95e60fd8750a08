package org.jstats.forecast_api.modules.calibration.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Qualitative verdict on one algorithm, emitted with every calibration run.
 *
 * @param healthScore 0-100 summary of win rate, calibration and streak
 */
public record RecalibrationRecommendation(
        Type type,
        String algorithmId,
        String algorithmName,
        Severity severity,
        String message,
        String suggestedAction,
        String impact,
        int healthScore
) {
    public enum Type {
        PAUSE_ALGORITHM,
        DECREASE_CONFIDENCE,
        BOOST_ALGORITHM,
        NO_CHANGE;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Severity {
        LOW,
        MEDIUM,
        HIGH,
        CRITICAL;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
