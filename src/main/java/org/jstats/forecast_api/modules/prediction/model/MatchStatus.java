package org.jstats.forecast_api.modules.prediction.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonProperty;

public enum MatchStatus {
    @JsonEnumDefaultValue
    @JsonProperty("scheduled")
    SCHEDULED,
    @JsonProperty("live")
    LIVE,
    @JsonProperty("finished")
    FINISHED
}
