package org.jstats.forecast_api.modules.prediction.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Settlement state of a stored prediction.
 */
public enum PredictionStatus {
    PENDING,
    WON,
    LOST,
    VOID;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PredictionStatus fromCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isDecided() {
        return this == WON || this == LOST;
    }
}
