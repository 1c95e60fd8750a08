package org.jstats.forecast_api.core.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig {

    @Bean
    Jackson2ObjectMapperBuilderCustomizer jacksonCustomizer() {
        return builder -> builder
                // Unknown match status strings fall back to @JsonEnumDefaultValue
                .featuresToEnable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE)
                // Upstream callers add fields we do not model yet
                .featuresToDisable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                // generatedAt / lastUpdated as ISO-8601
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                // optional factors (historical, injuries, weather) are omitted when absent
                .serializationInclusion(JsonInclude.Include.NON_NULL);
    }
}
