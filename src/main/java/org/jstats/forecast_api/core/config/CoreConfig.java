package org.jstats.forecast_api.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Cross-cutting beans: the UTC clock every timestamp is taken from, retry
 * proxies for the repositories and the scheduler that drives the calibration job.
 */
@Configuration
@EnableRetry
@EnableScheduling
public class CoreConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
