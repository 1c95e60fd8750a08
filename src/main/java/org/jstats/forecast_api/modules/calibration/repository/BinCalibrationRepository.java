package org.jstats.forecast_api.modules.calibration.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.NullMarked;
import org.jstats.forecast_api.modules.calibration.model.BinCalibrationResult;
import org.postgresql.util.PGobject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Repository;

import java.sql.SQLException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Append-only history of confidence-bin calibrations; forecasts read the most recent one.
 */
@Repository
@NullMarked
public class BinCalibrationRepository {

    private static final Logger log = LoggerFactory.getLogger(BinCalibrationRepository.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper mapper;

    public BinCalibrationRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper mapper) {
        this.jdbc = jdbc;
        this.mapper = mapper;
    }

    public void save(BinCalibrationResult result, Instant calibratedAt) {
        final var sql = """
                INSERT INTO bin_calibration (overall_adjustment_factor, calibrated, result, calibrated_at)
                VALUES (:overallAdjustmentFactor, :calibrated, :result, :calibratedAt)
                """;
        var params = new MapSqlParameterSource()
                .addValue("overallAdjustmentFactor", result.overallAdjustmentFactor())
                .addValue("calibrated", result.calibrated())
                .addValue("result", toJsonb(result))
                .addValue("calibratedAt", calibratedAt.atOffset(ZoneOffset.UTC));
        jdbc.update(sql, params);
    }

    @Retryable(
            retryFor = TransientDataAccessException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 200, multiplier = 2.0, maxDelay = 1000)
    )
    public Optional<BinCalibrationResult> findLatest() {
        final var sql = """
                SELECT id, result
                FROM bin_calibration
                ORDER BY calibrated_at DESC, id DESC
                LIMIT 1
                """;
        return jdbc.query(sql, new MapSqlParameterSource(), (rs, rowNum) -> fromJson(rs.getLong("id"), rs.getString("result")))
                .stream()
                .findFirst();
    }

    // No bin calibration leaves confidences as the weights produced them
    @Recover
    public Optional<BinCalibrationResult> recoverFindLatest(TransientDataAccessException ex) {
        if (log.isWarnEnabled()) {
            log.warn("Bin calibration unavailable after retries: {}", ex.getMessage());
        }
        return Optional.empty();
    }

    private BinCalibrationResult fromJson(long id, String json) {
        try {
            return mapper.readValue(json, BinCalibrationResult.class);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Unreadable bin calibration " + id, e);
        }
    }

    private PGobject toJsonb(BinCalibrationResult result) {
        PGobject jsonb = new PGobject();
        jsonb.setType("jsonb");
        try {
            jsonb.setValue(mapper.writeValueAsString(result));
        } catch (JsonProcessingException | SQLException e) {
            throw new IllegalArgumentException("Failed to set JSONB bin calibration", e);
        }
        return jsonb;
    }
}
