package org.jstats.forecast_api.modules.prediction.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.forecast_api.modules.prediction.model.PredictionFactors;
import org.jstats.forecast_api.modules.prediction.model.PredictionResult;
import org.jstats.forecast_api.modules.prediction.model.PredictionStatus;
import org.jstats.forecast_api.modules.prediction.model.Recommendation;
import org.jstats.forecast_api.modules.prediction.model.ScorePair;
import org.jstats.forecast_api.modules.prediction.model.StoredPrediction;
import org.postgresql.util.PGobject;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Write side for predictions and the reads that settlement and calibration need.
 * One row per (match, algorithm); re-predicting a pending match overwrites it.
 */
@Repository
@NullMarked
public class PredictionRepository {

    private static final RowMapper<StoredPrediction> ROW_MAPPER = (rs, rowNum) -> {
        int rating = rs.getInt("accuracy_rating");
        Integer accuracy = rs.wasNull() ? null : rating;
        Timestamp settled = rs.getTimestamp("settled_at");
        return new StoredPrediction(
                rs.getLong("id"),
                rs.getString("match_id"),
                rs.getString("algorithm_id"),
                Recommendation.fromCode(rs.getString("recommendation")),
                rs.getDouble("confidence"),
                new ScorePair(rs.getDouble("projected_home"), rs.getDouble("projected_away")),
                PredictionStatus.fromCode(rs.getString("status")),
                accuracy,
                rs.getTimestamp("generated_at").toInstant(),
                settled != null ? settled.toInstant() : null);
    };

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper mapper;

    public PredictionRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper mapper) {
        this.jdbc = jdbc;
        this.mapper = mapper;
    }

    public void save(PredictionResult prediction) {
        jdbc.update(UPSERT, params(prediction));
    }

    public void saveBatch(List<PredictionResult> predictions) {
        if (predictions.isEmpty()) {
            return;
        }
        var batch = predictions.stream()
                .map(this::params)
                .toArray(MapSqlParameterSource[]::new);
        jdbc.batchUpdate(UPSERT, batch);
    }

    public List<StoredPrediction> findPending(String matchId) {
        final var sql = """
                SELECT id, match_id, algorithm_id, recommendation, confidence,
                       projected_home, projected_away, status, accuracy_rating,
                       generated_at, settled_at
                FROM prediction
                WHERE match_id = :matchId
                  AND status = 'pending'
                ORDER BY id
                """;
        return jdbc.query(sql, new MapSqlParameterSource("matchId", matchId), ROW_MAPPER);
    }

    public List<StoredPrediction> findByMatch(String matchId) {
        final var sql = """
                SELECT id, match_id, algorithm_id, recommendation, confidence,
                       projected_home, projected_away, status, accuracy_rating,
                       generated_at, settled_at
                FROM prediction
                WHERE match_id = :matchId
                ORDER BY id
                """;
        return jdbc.query(sql, new MapSqlParameterSource("matchId", matchId), ROW_MAPPER);
    }

    /**
     * Settled (won, lost or void) predictions since the cutoff, most recent first.
     */
    public List<StoredPrediction> findSettledSince(Instant since) {
        final var sql = """
                SELECT id, match_id, algorithm_id, recommendation, confidence,
                       projected_home, projected_away, status, accuracy_rating,
                       generated_at, settled_at
                FROM prediction
                WHERE status <> 'pending'
                  AND settled_at >= :since
                ORDER BY settled_at DESC, id DESC
                """;
        return jdbc.query(sql, new MapSqlParameterSource("since", toOffset(since)), ROW_MAPPER);
    }

    public int settle(long id, PredictionStatus status, @Nullable Integer accuracyRating, Instant settledAt) {
        final var sql = """
                UPDATE prediction
                SET status = :status,
                    accuracy_rating = :accuracy,
                    settled_at = :settledAt
                WHERE id = :id
                  AND status = 'pending'
                """;
        final var params = new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("status", status.code())
                .addValue("accuracy", accuracyRating)
                .addValue("settledAt", toOffset(settledAt));
        return jdbc.update(sql, params);
    }

    private static final String UPSERT = """
            INSERT INTO prediction
              (match_id, algorithm_id, algorithm_name, recommendation, confidence, true_probability,
               projected_home, projected_away, implied_odds, expected_value, ev_percentage,
               kelly_fraction, kelly_stake_units, factors, generated_at)
            VALUES
              (:matchId, :algorithmId, :algorithmName, :recommendation, :confidence, :trueProbability,
               :projectedHome, :projectedAway, :impliedOdds, :expectedValue, :evPercentage,
               :kellyFraction, :kellyStakeUnits, :factors, :generatedAt)
            ON CONFLICT (match_id, algorithm_id)
            DO UPDATE SET
               recommendation = EXCLUDED.recommendation,
               confidence = EXCLUDED.confidence,
               true_probability = EXCLUDED.true_probability,
               projected_home = EXCLUDED.projected_home,
               projected_away = EXCLUDED.projected_away,
               implied_odds = EXCLUDED.implied_odds,
               expected_value = EXCLUDED.expected_value,
               ev_percentage = EXCLUDED.ev_percentage,
               kelly_fraction = EXCLUDED.kelly_fraction,
               kelly_stake_units = EXCLUDED.kelly_stake_units,
               factors = EXCLUDED.factors,
               generated_at = EXCLUDED.generated_at
            WHERE prediction.status = 'pending'
            """;

    private MapSqlParameterSource params(PredictionResult p) {
        return new MapSqlParameterSource()
                .addValue("matchId", p.matchId())
                .addValue("algorithmId", p.algorithmId())
                .addValue("algorithmName", p.algorithmName())
                .addValue("recommendation", p.recommendation().code())
                .addValue("confidence", p.confidence())
                .addValue("trueProbability", p.trueProbability())
                .addValue("projectedHome", p.projectedScore().home())
                .addValue("projectedAway", p.projectedScore().away())
                .addValue("impliedOdds", p.impliedOdds())
                .addValue("expectedValue", p.expectedValue())
                .addValue("evPercentage", p.evPercentage())
                .addValue("kellyFraction", p.kellyFraction())
                .addValue("kellyStakeUnits", p.kellyStakeUnits())
                .addValue("factors", toJsonb(p.factors()))
                .addValue("generatedAt", toOffset(p.generatedAt()));
    }

    private PGobject toJsonb(PredictionFactors factors) {
        PGobject jsonb = new PGobject();
        jsonb.setType("jsonb");
        try {
            jsonb.setValue(mapper.writeValueAsString(factors));
        } catch (JsonProcessingException | SQLException e) {
            throw new IllegalArgumentException("Failed to set JSONB factors", e);
        }
        return jsonb;
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }
}
