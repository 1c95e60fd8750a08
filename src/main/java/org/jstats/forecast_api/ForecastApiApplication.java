package org.jstats.forecast_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ForecastApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForecastApiApplication.class, args);
    }
}
