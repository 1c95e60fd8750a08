package org.jstats.forecast_api.modules.prediction.repository;

import org.jspecify.annotations.NullMarked;
import org.jstats.forecast_api.modules.prediction.model.FinalScore;
import org.jstats.forecast_api.modules.prediction.model.HistoricalMatchup;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Final scores of finished matches; source of the head-to-head aggregate.
 */
@Repository
@NullMarked
public class MatchResultRepository {

    private final NamedParameterJdbcTemplate jdbc;

    public MatchResultRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void record(String matchId, FinalScore score, Instant finishedAt) {
        final var sql = """
                INSERT INTO match_result
                  (match_id, home_team_id, away_team_id, league, home_score, away_score, finished_at)
                VALUES
                  (:matchId, :homeTeamId, :awayTeamId, :league, :homeScore, :awayScore, :finishedAt)
                ON CONFLICT (match_id)
                DO UPDATE SET
                   home_score = EXCLUDED.home_score,
                   away_score = EXCLUDED.away_score,
                   finished_at = EXCLUDED.finished_at
                """;
        final var params = new MapSqlParameterSource()
                .addValue("matchId", matchId)
                .addValue("homeTeamId", score.homeTeamId())
                .addValue("awayTeamId", score.awayTeamId())
                .addValue("league", score.league())
                .addValue("homeScore", score.homeScore())
                .addValue("awayScore", score.awayScore())
                .addValue("finishedAt", finishedAt.atOffset(ZoneOffset.UTC));
        jdbc.update(sql, params);
    }

    /**
     * Every meeting of the two teams at either venue, counted from {@code homeTeamId}'s side.
     */
    public HistoricalMatchup headToHead(String homeTeamId, String awayTeamId) {
        final var sql = """
                SELECT
                  count(*) FILTER (WHERE (home_team_id = :home AND home_score > away_score)
                                      OR (away_team_id = :home AND away_score > home_score)) AS home_wins,
                  count(*) FILTER (WHERE (home_team_id = :away AND home_score > away_score)
                                      OR (away_team_id = :away AND away_score > home_score)) AS away_wins,
                  count(*) FILTER (WHERE home_score = away_score) AS draws,
                  count(*) AS total_games,
                  avg(CASE WHEN home_team_id = :home THEN home_score ELSE away_score END) AS avg_home,
                  avg(CASE WHEN home_team_id = :home THEN away_score ELSE home_score END) AS avg_away
                FROM match_result
                WHERE (home_team_id = :home AND away_team_id = :away)
                   OR (home_team_id = :away AND away_team_id = :home)
                """;
        final var params = new MapSqlParameterSource()
                .addValue("home", homeTeamId)
                .addValue("away", awayTeamId);
        final var matchup = jdbc.query(sql, params, rs -> {
            if (!rs.next()) {
                return null;
            }
            double avgHome = rs.getDouble("avg_home");
            Double home = rs.wasNull() ? null : avgHome;
            double avgAway = rs.getDouble("avg_away");
            Double away = rs.wasNull() ? null : avgAway;
            return new HistoricalMatchup(
                    rs.getInt("home_wins"),
                    rs.getInt("away_wins"),
                    rs.getInt("draws"),
                    rs.getInt("total_games"),
                    home,
                    away);
        });
        return matchup != null ? matchup : HistoricalMatchup.empty();
    }
}
