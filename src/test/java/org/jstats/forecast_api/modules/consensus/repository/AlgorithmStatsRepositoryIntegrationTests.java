package org.jstats.forecast_api.modules.consensus.repository;

import org.jstats.forecast_api.modules.consensus.model.AlgorithmStats;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

import java.util.List;

import static org.jstats.forecast_api.modules.prediction.PredictionFixtures.NOW;
import static org.junit.jupiter.api.Assertions.*;

@JdbcTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({AlgorithmStatsRepository.class, AlgorithmStatsRepositoryIntegrationTests.TestContainersLocal.class})
class AlgorithmStatsRepositoryIntegrationTests {

    @TestConfiguration(proxyBeanMethods = false)
    static class TestContainersLocal {
        @Bean
        @ServiceConnection
        PostgreSQLContainer<?> postgresContainer() {
            return new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));
        }
    }

    @Autowired
    AlgorithmStatsRepository repository;

    @Test
    void upsert_replacesExistingRow() {
        repository.upsert(new AlgorithmStats("alg-a", 55.0, 20, 11, 60.0), NOW);
        repository.upsert(new AlgorithmStats("alg-a", 62.5, 24, 15, 61.0), NOW.plusSeconds(3600));

        List<AlgorithmStats> all = repository.findAll();

        assertEquals(1, all.size());
        assertEquals(62.5, all.get(0).winRate(), 1e-9);
        assertEquals(24, all.get(0).totalPredictions());
    }

    @Test
    void nullRates_roundTripAsNull() {
        repository.upsert(new AlgorithmStats("alg-b", null, 0, 0, null), NOW);

        AlgorithmStats stats = repository.findAll().get(0);

        assertNull(stats.winRate());
        assertNull(stats.avgConfidence());
        assertEquals(50, stats.winRateOrDefault(), 1e-9);
    }
}
