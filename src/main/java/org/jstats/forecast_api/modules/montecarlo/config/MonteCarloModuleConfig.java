package org.jstats.forecast_api.modules.montecarlo.config;

import org.jstats.forecast_api.modules.montecarlo.model.MonteCarloConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@ConfigurationProperties(prefix = "forecast.monte-carlo")
record MonteCarloProperties(
        @DefaultValue("200") int samples,
        @DefaultValue("6") double confidenceNoise,
        @DefaultValue("4") double scoreNoise,
        @DefaultValue("0.08") double probabilityNoise,
        @DefaultValue("10") double lowerPercentile,
        @DefaultValue("90") double upperPercentile,
        Long seed) {}

@Configuration
@EnableConfigurationProperties(MonteCarloProperties.class)
public class MonteCarloModuleConfig {

    private static final Logger log = LoggerFactory.getLogger(MonteCarloModuleConfig.class);

    @Bean
    MonteCarloConfig monteCarloConfig(MonteCarloProperties props) {
        if (props.lowerPercentile() < 0 || props.upperPercentile() > 100
                || props.lowerPercentile() > props.upperPercentile()) {
            throw new IllegalStateException("forecast.monte-carlo percentiles must satisfy 0 <= lower <= upper <= 100");
        }
        if (props.seed() != null && log.isInfoEnabled()) {
            log.info("Monte Carlo sampling seeded with {}", props.seed());
        }
        return new MonteCarloConfig(
                Math.max(1, props.samples()),
                props.confidenceNoise(),
                props.scoreNoise(),
                props.probabilityNoise(),
                props.lowerPercentile(),
                props.upperPercentile(),
                props.seed());
    }
}
