package org.jstats.forecast_api.modules.ensemble.config;

import org.jstats.forecast_api.modules.ensemble.model.EnsembleConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@ConfigurationProperties(prefix = "forecast.ensemble")
record EnsembleProperties(
        @DefaultValue("0.15") double learningRate,
        @DefaultValue("5") int boostingRounds,
        @DefaultValue("0.9") double sequentialDecay,
        @DefaultValue("0.12") double diversityWeight,
        @DefaultValue("0.3") double calibrationStrength) {}

@Configuration
@EnableConfigurationProperties(EnsembleProperties.class)
public class EnsembleModuleConfig {

    @Bean
    EnsembleConfig ensembleConfig(EnsembleProperties props) {
        if (props.learningRate() <= 0 || props.learningRate() >= 1) {
            throw new IllegalStateException("forecast.ensemble.learning-rate must be in (0,1), was " + props.learningRate());
        }
        return new EnsembleConfig(
                props.learningRate(),
                Math.max(0, props.boostingRounds()),
                props.sequentialDecay(),
                props.diversityWeight(),
                props.calibrationStrength());
    }
}
