package org.jstats.forecast_api.modules.consensus.repository;

import org.jspecify.annotations.NullMarked;
import org.jstats.forecast_api.modules.consensus.model.AlgorithmStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

@Repository
@NullMarked
public class AlgorithmStatsRepository {

    private static final Logger log = LoggerFactory.getLogger(AlgorithmStatsRepository.class);

    private static final RowMapper<AlgorithmStats> ROW_MAPPER = (rs, rowNum) -> new AlgorithmStats(
            rs.getString("algorithm_id"),
            rs.getObject("win_rate", Double.class),
            rs.getObject("total_predictions", Integer.class),
            rs.getObject("correct_predictions", Integer.class),
            rs.getObject("avg_confidence", Double.class));

    private final NamedParameterJdbcTemplate jdbc;

    public AlgorithmStatsRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Retryable(
            retryFor = TransientDataAccessException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 200, multiplier = 2.0, maxDelay = 1000)
    )
    public List<AlgorithmStats> findAll() {
        final var sql = """
                SELECT algorithm_id, win_rate, total_predictions, correct_predictions, avg_confidence
                FROM algorithm_stats
                ORDER BY algorithm_id
                """;
        return jdbc.query(sql, ROW_MAPPER);
    }

    // Callers treat an empty list as "no history yet"
    @Recover
    public List<AlgorithmStats> recoverFindAll(TransientDataAccessException ex) {
        if (log.isWarnEnabled()) {
            log.warn("Algorithm stats unavailable after retries: {}", ex.getMessage());
        }
        return List.of();
    }

    public void upsert(AlgorithmStats stats, Instant updatedAt) {
        final var sql = """
                INSERT INTO algorithm_stats
                  (algorithm_id, win_rate, total_predictions, correct_predictions, avg_confidence, updated_at)
                VALUES
                  (:algorithmId, :winRate, :totalPredictions, :correctPredictions, :avgConfidence, :updatedAt)
                ON CONFLICT (algorithm_id)
                DO UPDATE SET
                   win_rate = EXCLUDED.win_rate,
                   total_predictions = EXCLUDED.total_predictions,
                   correct_predictions = EXCLUDED.correct_predictions,
                   avg_confidence = EXCLUDED.avg_confidence,
                   updated_at = EXCLUDED.updated_at
                """;
        final var params = new MapSqlParameterSource()
                .addValue("algorithmId", stats.algorithmId())
                .addValue("winRate", stats.winRate())
                .addValue("totalPredictions", stats.totalPredictions())
                .addValue("correctPredictions", stats.correctPredictions())
                .addValue("avgConfidence", stats.avgConfidence())
                .addValue("updatedAt", updatedAt.atOffset(ZoneOffset.UTC));
        jdbc.update(sql, params);
    }
}
