package org.jstats.forecast_api.modules.prediction.repository;

import org.jstats.forecast_api.modules.prediction.model.FinalScore;
import org.jstats.forecast_api.modules.prediction.model.HistoricalMatchup;
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

import static org.jstats.forecast_api.modules.prediction.PredictionFixtures.NOW;
import static org.junit.jupiter.api.Assertions.*;

@JdbcTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({MatchResultRepository.class, MatchResultRepositoryIntegrationTests.TestContainersLocal.class})
class MatchResultRepositoryIntegrationTests {

    @TestConfiguration(proxyBeanMethods = false)
    static class TestContainersLocal {
        @Bean
        @ServiceConnection
        PostgreSQLContainer<?> postgresContainer() {
            return new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));
        }
    }

    @Autowired
    MatchResultRepository repository;

    @Test
    void headToHead_countsMeetingsAtEitherVenueFromHomeTeamsSide() {
        repository.record("g1", new FinalScore("lal", "bos", "NBA", 2, 1), NOW);
        repository.record("g2", new FinalScore("bos", "lal", "NBA", 3, 0), NOW);
        repository.record("g3", new FinalScore("lal", "bos", "NBA", 1, 1), NOW);
        repository.record("g4", new FinalScore("lal", "mia", "NBA", 9, 0), NOW);

        HistoricalMatchup matchup = repository.headToHead("lal", "bos");

        assertEquals(1, matchup.homeWins());
        assertEquals(1, matchup.awayWins());
        assertEquals(1, matchup.draws());
        assertEquals(3, matchup.totalGames());
        assertEquals(1.0, matchup.avgHomeScore(), 1e-9);
        assertEquals(5.0 / 3, matchup.avgAwayScore(), 1e-9);
    }

    @Test
    void recordingSameMatchTwice_keepsLatestScore() {
        repository.record("g1", new FinalScore("lal", "bos", "NBA", 2, 1), NOW);
        repository.record("g1", new FinalScore("lal", "bos", "NBA", 2, 4), NOW.plusSeconds(60));

        HistoricalMatchup matchup = repository.headToHead("lal", "bos");

        assertEquals(1, matchup.totalGames());
        assertEquals(1, matchup.awayWins());
    }

    @Test
    void noMeetings_returnsEmptyAggregate() {
        HistoricalMatchup matchup = repository.headToHead("lal", "den");

        assertEquals(0, matchup.totalGames());
        assertNull(matchup.avgHomeScore());
        assertEquals(0.5, matchup.homeWinPct(), 1e-9);
    }
}
