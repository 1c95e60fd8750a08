package org.jstats.forecast_api.modules.calibration.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A notable change made by a calibration run.
 */
public record RecalibrationAction(
        String algorithmId,
        Type action,
        double previousValue,
        double newValue,
        String reason
) {
    public enum Type {
        WEIGHT_INCREASED("Weight increased"),
        WEIGHT_DECREASED("Weight decreased"),
        CONFIDENCE_MULTIPLIER_ADJUSTED("Confidence multiplier adjusted");

        private final String label;

        Type(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }
    }
}
