package org.jstats.forecast_api.core.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    OpenAPI apiInfo() {
        return new OpenAPI()
                .info(new Info()
                        .title("MatchLens Forecast API")
                        .description("Multi-algorithm match forecasts, ensemble consensus, uncertainty bands and model calibration.")
                        .version("v1")
                        .contact(new Contact().name("MatchLens"))
                        .license(new License().name("Apache 2.0")));
    }
}
