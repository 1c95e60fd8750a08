package org.jstats.forecast_api.modules.prediction.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Side a predictor backs for a match. {@code SKIP} means no bet.
 */
public enum Recommendation {
    HOME("home"),
    AWAY("away"),
    DRAW("draw"),
    SKIP("skip");

    private final String code;

    Recommendation(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** Unknown or blank codes map to {@link #SKIP}. */
    @JsonCreator
    public static Recommendation fromCode(String code) {
        if (code == null) {
            return SKIP;
        }
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "home" -> HOME;
            case "away" -> AWAY;
            case "draw" -> DRAW;
            default -> SKIP;
        };
    }

    public boolean isSide() {
        return this != SKIP;
    }
}
