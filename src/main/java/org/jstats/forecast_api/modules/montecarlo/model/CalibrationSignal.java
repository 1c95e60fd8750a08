package org.jstats.forecast_api.modules.montecarlo.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CalibrationSignal {
    WELL_CALIBRATED("well-calibrated"),
    OVERCONFIDENT("overconfident"),
    UNDERCONFIDENT("underconfident"),
    UNCERTAIN("uncertain");

    private final String code;

    CalibrationSignal(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
