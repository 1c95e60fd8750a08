package org.jstats.forecast_api.modules.calibration.repository;

import org.jspecify.annotations.NullMarked;
import org.jstats.forecast_api.modules.calibration.model.ModelWeight;
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

import java.time.ZoneOffset;
import java.util.List;

/**
 * Append-only history of calibrated weights; readers only ever see the latest row per algorithm.
 */
@Repository
@NullMarked
public class ModelWeightRepository {

    private static final Logger log = LoggerFactory.getLogger(ModelWeightRepository.class);

    private static final RowMapper<ModelWeight> ROW_MAPPER = (rs, rowNum) -> new ModelWeight(
            rs.getString("algorithm_id"),
            rs.getString("algorithm_name"),
            rs.getDouble("base_weight"),
            rs.getDouble("adjusted_weight"),
            rs.getString("adjustment_reason"),
            rs.getDouble("confidence_multiplier"),
            rs.getDouble("min_confidence_threshold"),
            rs.getTimestamp("last_updated").toInstant());

    private final NamedParameterJdbcTemplate jdbc;

    public ModelWeightRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void saveAll(List<ModelWeight> weights) {
        if (weights.isEmpty()) {
            return;
        }
        final var sql = """
                INSERT INTO model_weight
                  (algorithm_id, algorithm_name, base_weight, adjusted_weight, adjustment_reason,
                   confidence_multiplier, min_confidence_threshold, last_updated)
                VALUES
                  (:algorithmId, :algorithmName, :baseWeight, :adjustedWeight, :adjustmentReason,
                   :confidenceMultiplier, :minConfidenceThreshold, :lastUpdated)
                """;
        var batch = weights.stream()
                .map(w -> new MapSqlParameterSource()
                        .addValue("algorithmId", w.algorithmId())
                        .addValue("algorithmName", w.algorithmName())
                        .addValue("baseWeight", w.baseWeight())
                        .addValue("adjustedWeight", w.adjustedWeight())
                        .addValue("adjustmentReason", w.adjustmentReason())
                        .addValue("confidenceMultiplier", w.confidenceMultiplier())
                        .addValue("minConfidenceThreshold", w.minConfidenceThreshold())
                        .addValue("lastUpdated", w.lastUpdated().atOffset(ZoneOffset.UTC)))
                .toArray(MapSqlParameterSource[]::new);
        jdbc.batchUpdate(sql, batch);
    }

    @Retryable(
            retryFor = TransientDataAccessException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 200, multiplier = 2.0, maxDelay = 1000)
    )
    public List<ModelWeight> findLatest() {
        final var sql = """
                SELECT DISTINCT ON (algorithm_id)
                       algorithm_id, algorithm_name, base_weight, adjusted_weight, adjustment_reason,
                       confidence_multiplier, min_confidence_threshold, last_updated
                FROM model_weight
                ORDER BY algorithm_id, last_updated DESC, id DESC
                """;
        return jdbc.query(sql, ROW_MAPPER);
    }

    // No calibrated weights behaves like a fresh install
    @Recover
    public List<ModelWeight> recoverFindLatest(TransientDataAccessException ex) {
        if (log.isWarnEnabled()) {
            log.warn("Model weights unavailable after retries: {}", ex.getMessage());
        }
        return List.of();
    }
}
