package org.jstats.forecast_api.modules.calibration.config;

import org.jstats.forecast_api.modules.calibration.model.CalibrationConfig;
import org.jstats.forecast_api.modules.prediction.service.AlgorithmRegistry;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

@ConfigurationProperties(prefix = "forecast.calibration")
record CalibrationProperties(
        @DefaultValue("10") int minBets,
        @DefaultValue("10") double underperformanceThreshold,
        @DefaultValue("10") double overperformanceThreshold,
        @DefaultValue("0.15") double maxWeightChange,
        @DefaultValue("15") double maxConfidenceReduction,
        @DefaultValue("10") double maxConfidenceBoost,
        @DefaultValue("45") double minConfidenceFloor,
        @DefaultValue("5") int coldStreakThreshold,
        @DefaultValue("5") int hotStreakThreshold,
        @DefaultValue("30") int windowDays,
        Map<String, Double> baseWeights,
        @DefaultValue("0.33") double defaultBaseWeight) {}

@Configuration
@EnableConfigurationProperties(CalibrationProperties.class)
public class CalibrationModuleConfig {

    static final Map<String, Double> DEFAULT_BASE_WEIGHTS = Map.of(
            AlgorithmRegistry.ML_POWER_INDEX, 0.34,
            AlgorithmRegistry.VALUE_PICK_FINDER, 0.33,
            AlgorithmRegistry.STATISTICAL_EDGE, 0.33);

    @Bean
    CalibrationConfig calibrationConfig(CalibrationProperties props) {
        if (props.windowDays() <= 0) {
            throw new IllegalStateException("forecast.calibration.window-days must be positive, was " + props.windowDays());
        }
        var baseWeights = props.baseWeights() == null || props.baseWeights().isEmpty()
                ? DEFAULT_BASE_WEIGHTS
                : props.baseWeights();
        return new CalibrationConfig(
                props.minBets(),
                props.underperformanceThreshold(),
                props.overperformanceThreshold(),
                props.maxWeightChange(),
                props.maxConfidenceReduction(),
                props.maxConfidenceBoost(),
                props.minConfidenceFloor(),
                props.coldStreakThreshold(),
                props.hotStreakThreshold(),
                props.windowDays(),
                baseWeights,
                props.defaultBaseWeight());
    }
}
