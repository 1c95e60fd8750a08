package org.jstats.forecast_api.modules.ensemble.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PatternType {
    STREAK,
    ALTERNATING,
    REGRESSION,
    BREAKOUT,
    NONE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
