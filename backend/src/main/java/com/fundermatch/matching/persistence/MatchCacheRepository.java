package com.fundermatch.matching.persistence;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class MatchCacheRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public MatchCacheRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public MatchCacheRow findValid(long charityNumber, String cacheKey, Instant now) {
        List<MatchCacheRow> rows = jdbc.query(
            """
                SELECT charity_number, cache_key, charity_name, matches, funder_count,
                       last_sync_at, created_at, expires_at
                FROM match_cache
                WHERE charity_number = :charityNumber
                  AND cache_key = :cacheKey
                  AND expires_at > :now
                """,
            new MapSqlParameterSource()
                .addValue("charityNumber", charityNumber)
                .addValue("cacheKey", cacheKey)
                .addValue("now", toTimestamp(now)),
            (rs, rowNum) -> new MatchCacheRow(
                rs.getLong("charity_number"),
                rs.getString("cache_key"),
                rs.getString("charity_name"),
                rs.getString("matches"),
                rs.getInt("funder_count"),
                toInstant(rs.getTimestamp("last_sync_at")),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("expires_at"))
            )
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public void upsert(MatchCacheRow row) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("charityNumber", row.charityNumber())
            .addValue("cacheKey", row.cacheKey())
            .addValue("charityName", row.charityName())
            .addValue("matches", row.matchesJson())
            .addValue("funderCount", row.funderCount())
            .addValue("lastSyncAt", toTimestamp(row.lastSyncAt()))
            .addValue("createdAt", toTimestamp(row.createdAt()))
            .addValue("expiresAt", toTimestamp(row.expiresAt()));

        String update = """
            UPDATE match_cache
            SET charity_name = :charityName,
                matches = :matches,
                funder_count = :funderCount,
                last_sync_at = :lastSyncAt,
                created_at = :createdAt,
                expires_at = :expiresAt
            WHERE charity_number = :charityNumber
              AND cache_key = :cacheKey
            """;
        int updated = jdbc.update(update, params);
        if (updated == 0) {
            try {
                jdbc.update(
                    """
                        INSERT INTO match_cache (
                            charity_number, cache_key, charity_name, matches, funder_count,
                            last_sync_at, created_at, expires_at
                        )
                        VALUES (
                            :charityNumber, :cacheKey, :charityName, :matches, :funderCount,
                            :lastSyncAt, :createdAt, :expiresAt
                        )
                        """,
                    params
                );
            } catch (DataIntegrityViolationException ignored) {
                jdbc.update(update, params);
            }
        }
    }

    /**
     * Deletes rows computed against data older than {@code syncDate}, including rows computed
     * before any sync had completed.
     */
    public int deleteComputedBefore(Instant syncDate) {
        return jdbc.update(
            """
                DELETE FROM match_cache
                WHERE last_sync_at IS NULL
                   OR last_sync_at < :syncDate
                """,
            new MapSqlParameterSource("syncDate", toTimestamp(syncDate))
        );
    }

    public int deleteExpired(Instant now) {
        return jdbc.update(
            "DELETE FROM match_cache WHERE expires_at <= :now",
            new MapSqlParameterSource("now", toTimestamp(now))
        );
    }

    public long count() {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM match_cache", Long.class);
        return count == null ? 0L : count;
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
