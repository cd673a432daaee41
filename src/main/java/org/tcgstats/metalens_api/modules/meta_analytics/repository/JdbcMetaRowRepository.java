package org.tcgstats.metalens_api.modules.meta_analytics.repository;

import org.jspecify.annotations.NullMarked;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.InvalidDataAccessResourceUsageException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Repository;
import org.tcgstats.metalens_api.modules.meta_analytics.engine.MetaRowSource;
import org.tcgstats.metalens_api.modules.meta_analytics.model.ArchetypeRow;
import org.tcgstats.metalens_api.modules.meta_analytics.model.MatchRow;
import org.tcgstats.metalens_api.modules.meta_analytics.model.TimePeriod;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

@Repository
@NullMarked
public class JdbcMetaRowRepository implements MetaRowSource {

    private static final Logger log = LoggerFactory.getLogger(JdbcMetaRowRepository.class);

    private static final RowMapper<ArchetypeRow> ARCHETYPE_ROW = (rs, n) -> new ArchetypeRow(
            rs.getLong("archetype_group_id"),
            rs.getString("main_title"),
            rs.getString("color_identity"),
            rs.getString("strategy"),
            instant(rs, "tournament_date"));

    private static final RowMapper<MatchRow> MATCH_ROW = (rs, n) -> new MatchRow(
            rs.getLong("player_archetype_id"),
            rs.getString("player_archetype"),
            rs.getLong("opponent_archetype_id"),
            rs.getString("opponent_archetype"),
            rs.getString("player1_id"),
            rs.getString("player2_id"),
            rs.getString("winner_id"),
            instant(rs, "tournament_date"));

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcMetaRowRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * One row per decklist with an archetype assigned, for tournaments starting in {@code [start, end)}.
     * Transient, connection and recoverable failures are retried with exponential backoff. Bad SQL
     * surfaces on the first attempt.
     */
    @Override
    @Retryable(
            retryFor = {
                    TransientDataAccessException.class,
                    DataAccessResourceFailureException.class,
                    RecoverableDataAccessException.class
            },
            noRetryFor = InvalidDataAccessResourceUsageException.class,
            notRecoverable = InvalidDataAccessResourceUsageException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 200, multiplier = 2.0, maxDelay = 2000),
            recover = "recoverArchetypeRows"
    )
    public List<ArchetypeRow> fetchArchetypeRows(String format, TimePeriod period) {
        var sql = """
                SELECT
                    ag.archetype_group_id,
                    ag.main_title,
                    ag.color_identity,
                    ag.strategy,
                    t.start_date AS tournament_date
                FROM decklists d
                JOIN archetype_groups ag ON d.archetype_group_id = ag.archetype_group_id
                JOIN tournaments t ON d.tournament_id = t.tournament_id
                WHERE ag.format = :format
                  AND t.start_date >= :start
                  AND t.start_date < :end
                """;
        var rows = jdbc.query(sql, params(format, period), ARCHETYPE_ROW);
        if (log.isDebugEnabled()) {
            log.debug("Loaded {} decklist rows for {} in [{}, {})", rows.size(), format, period.start(), period.end());
        }
        return rows;
    }

    /**
     * One row per decided match whose both seats registered a classified decklist, for
     * tournaments starting in {@code [start, end)}. Matches without a winner are excluded.
     */
    @Override
    @Retryable(
            retryFor = {
                    TransientDataAccessException.class,
                    DataAccessResourceFailureException.class,
                    RecoverableDataAccessException.class
            },
            noRetryFor = InvalidDataAccessResourceUsageException.class,
            notRecoverable = InvalidDataAccessResourceUsageException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 200, multiplier = 2.0, maxDelay = 2000),
            recover = "recoverMatchRows"
    )
    public List<MatchRow> fetchMatchRows(String format, TimePeriod period) {
        var sql = """
                SELECT
                    ag1.archetype_group_id AS player_archetype_id,
                    ag1.main_title AS player_archetype,
                    ag2.archetype_group_id AS opponent_archetype_id,
                    ag2.main_title AS opponent_archetype,
                    m.player1_id,
                    m.player2_id,
                    m.winner_id,
                    t.start_date AS tournament_date
                FROM matches m
                JOIN tournaments t ON m.tournament_id = t.tournament_id
                JOIN decklists d1 ON m.player1_id = d1.player_id AND m.tournament_id = d1.tournament_id
                JOIN decklists d2 ON m.player2_id = d2.player_id AND m.tournament_id = d2.tournament_id
                JOIN archetype_groups ag1 ON d1.archetype_group_id = ag1.archetype_group_id
                JOIN archetype_groups ag2 ON d2.archetype_group_id = ag2.archetype_group_id
                WHERE t.format = :format
                  AND t.start_date >= :start
                  AND t.start_date < :end
                  AND m.winner_id IS NOT NULL
                  AND m.winner_id IN (m.player1_id, m.player2_id)
                """;
        var rows = jdbc.query(sql, params(format, period), MATCH_ROW);
        if (log.isDebugEnabled()) {
            log.debug("Loaded {} match rows for {} in [{}, {})", rows.size(), format, period.start(), period.end());
        }
        return rows;
    }

    // ---------- @Recover handlers (run after final retry attempt fails) ----------
    @Recover
    public List<ArchetypeRow> recoverArchetypeRows(DataAccessException ex, String format, TimePeriod period) {
        log.warn("Giving up on decklist rows for {} in [{}, {}) after retries: {}",
                format, period.start(), period.end(), ex.getMessage());
        throw new MetaRowFetchException("Decklist rows for %s are temporarily unavailable".formatted(format), ex);
    }

    @Recover
    public List<MatchRow> recoverMatchRows(DataAccessException ex, String format, TimePeriod period) {
        log.warn("Giving up on match rows for {} in [{}, {}) after retries: {}",
                format, period.start(), period.end(), ex.getMessage());
        throw new MetaRowFetchException("Match rows for %s are temporarily unavailable".formatted(format), ex);
    }

    private static MapSqlParameterSource params(String format, TimePeriod period) {
        return new MapSqlParameterSource()
                .addValue("format", format)
                .addValue("start", OffsetDateTime.ofInstant(period.start(), ZoneOffset.UTC))
                .addValue("end", OffsetDateTime.ofInstant(period.end(), ZoneOffset.UTC));
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, OffsetDateTime.class).toInstant();
    }
}
