package com.fundermatch.grants.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fundermatch.grants.model.AggregateStats;
import com.fundermatch.grants.model.FunderRef;
import com.fundermatch.grants.model.GrantRecord;
import com.fundermatch.grants.model.Organisation;
import com.fundermatch.grants.model.OrganisationDetail;
import com.fundermatch.grants.model.StoredGrant;
import com.fundermatch.grants.model.SyncLogEntry;
import com.fundermatch.grants.model.SyncStatus;
import com.fundermatch.grants.model.SyncType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class GrantJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(GrantJdbcRepository.class);
    private static final int MAX_ERROR_MESSAGE_LENGTH = 4000;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public GrantJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("organisations", countTable("organisations"));
        counts.put("grants", countTable("grants"));
        counts.put("sync_logs", countTable("sync_logs"));
        return counts;
    }

    public long countTable(String tableName) {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
        return count == null ? 0L : count;
    }

    // ---- sync logs ----

    public Instant findLastCompletedSyncAt() {
        List<Instant> rows = jdbc.query(
            """
                SELECT completed_at
                FROM sync_logs
                WHERE status = 'completed'
                  AND completed_at IS NOT NULL
                ORDER BY completed_at DESC, id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> toInstant(rs.getTimestamp("completed_at"))
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public long insertSyncLog(SyncType syncType, Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("syncType", syncType.dbValue())
            .addValue("status", SyncStatus.RUNNING.dbValue())
            .addValue("startedAt", toTimestamp(startedAt));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO sync_logs (sync_type, status, orgs_synced, grants_synced, grants_skipped, started_at)
                VALUES (:syncType, :status, 0, 0, 0, :startedAt)
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key != null) {
            return key.longValue();
        }
        Long id = jdbc.queryForObject(
            """
                SELECT id
                FROM sync_logs
                WHERE started_at = :startedAt
                  AND status = :status
                ORDER BY id DESC
                LIMIT 1
                """,
            params,
            Long.class
        );
        if (id == null) {
            throw new IllegalStateException("Failed to insert sync log");
        }
        return id;
    }

    public void completeSyncLog(
        long syncLogId,
        int organisationsSynced,
        int grantsSynced,
        int grantsSkipped,
        Instant completedAt
    ) {
        finishSyncLog(syncLogId, SyncStatus.COMPLETED, organisationsSynced, grantsSynced, grantsSkipped, completedAt, null);
    }

    public void failSyncLog(
        long syncLogId,
        int organisationsSynced,
        int grantsSynced,
        int grantsSkipped,
        Instant completedAt,
        String errorMessage
    ) {
        finishSyncLog(syncLogId, SyncStatus.FAILED, organisationsSynced, grantsSynced, grantsSkipped, completedAt, errorMessage);
    }

    private void finishSyncLog(
        long syncLogId,
        SyncStatus status,
        int organisationsSynced,
        int grantsSynced,
        int grantsSkipped,
        Instant completedAt,
        String errorMessage
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", syncLogId)
            .addValue("status", status.dbValue())
            .addValue("orgsSynced", organisationsSynced)
            .addValue("grantsSynced", grantsSynced)
            .addValue("grantsSkipped", grantsSkipped)
            .addValue("completedAt", toTimestamp(completedAt))
            .addValue("errorMessage", truncate(errorMessage));
        // Only a running row may be finished, so each log is mutated at most once.
        int updated = jdbc.update(
            """
                UPDATE sync_logs
                SET status = :status,
                    orgs_synced = :orgsSynced,
                    grants_synced = :grantsSynced,
                    grants_skipped = :grantsSkipped,
                    completed_at = :completedAt,
                    error_message = :errorMessage
                WHERE id = :id
                  AND status = 'running'
                """,
            params
        );
        if (updated == 0) {
            log.warn("Sync log {} was not running; left unchanged (requested status {})", syncLogId, status.dbValue());
        }
    }

    public SyncLogEntry findSyncLog(long syncLogId) {
        List<SyncLogEntry> rows = jdbc.query(
            """
                SELECT id, sync_type, status, orgs_synced, grants_synced, grants_skipped,
                       started_at, completed_at, error_message
                FROM sync_logs
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", syncLogId),
            this::mapSyncLog
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<SyncLogEntry> findRecentSyncLogs(int limit) {
        int safeLimit = limit <= 0 ? 10 : limit;
        return jdbc.query(
            """
                SELECT id, sync_type, status, orgs_synced, grants_synced, grants_skipped,
                       started_at, completed_at, error_message
                FROM sync_logs
                ORDER BY started_at DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", safeLimit),
            this::mapSyncLog
        );
    }

    public List<SyncLogEntry> findRunningSyncLogs() {
        return jdbc.query(
            """
                SELECT id, sync_type, status, orgs_synced, grants_synced, grants_skipped,
                       started_at, completed_at, error_message
                FROM sync_logs
                WHERE status = 'running'
                ORDER BY started_at ASC, id ASC
                """,
            new MapSqlParameterSource(),
            this::mapSyncLog
        );
    }

    // ---- organisations ----

    public void upsertOrganisation(String orgId, String name, OrganisationDetail detail, Instant now) {
        AggregateStats funderStats = detail == null ? null : detail.funder();
        AggregateStats recipientStats = detail == null ? null : detail.recipient();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("orgId", orgId)
            .addValue("name", name == null || name.isBlank() ? orgId : name)
            .addValue("isFunder", funderStats != null)
            .addValue("isRecipient", recipientStats != null)
            .addValue("funderStats", toJson(funderStats))
            .addValue("recipientStats", toJson(recipientStats))
            .addValue("funderGrantCount", funderStats == null ? null : funderStats.totalGrants())
            .addValue("now", toTimestamp(now));

        String update = """
            UPDATE organisations
            SET name = :name,
                is_funder = :isFunder,
                is_recipient = :isRecipient,
                funder_stats = :funderStats,
                recipient_stats = :recipientStats,
                funder_grant_count = :funderGrantCount,
                updated_at = :now
            WHERE org_id = :orgId
            """;
        int updated = jdbc.update(update, params);
        if (updated == 0) {
            try {
                jdbc.update(
                    """
                        INSERT INTO organisations (
                            org_id, name, is_funder, is_recipient, funder_stats, recipient_stats,
                            funder_grant_count, created_at, updated_at
                        )
                        VALUES (
                            :orgId, :name, :isFunder, :isRecipient, :funderStats, :recipientStats,
                            :funderGrantCount, :now, :now
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
     * Funders to walk during the grant phase, in a stable order so that successive capped runs
     * visit the same funders first.
     */
    public List<FunderRef> findFundersForSync(int limit) {
        return jdbc.query(
            """
                SELECT org_id, name, last_grant_made_date
                FROM organisations
                WHERE is_funder = TRUE
                ORDER BY id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", Math.max(1, limit)),
            (rs, rowNum) -> new FunderRef(
                rs.getString("org_id"),
                rs.getString("name"),
                toInstant(rs.getTimestamp("last_grant_made_date"))
            )
        );
    }

    public List<Organisation> findTopFunders(int limit) {
        return jdbc.query(
            """
                SELECT org_id, name, is_funder, is_recipient, funder_stats, recipient_stats, last_grant_made_date
                FROM organisations
                WHERE is_funder = TRUE
                ORDER BY funder_grant_count DESC NULLS LAST, org_id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", Math.max(1, limit)),
            organisationMapper()
        );
    }

    public Organisation findOrganisation(String orgId) {
        List<Organisation> rows = jdbc.query(
            """
                SELECT org_id, name, is_funder, is_recipient, funder_stats, recipient_stats, last_grant_made_date
                FROM organisations
                WHERE org_id = :orgId
                """,
            new MapSqlParameterSource("orgId", orgId),
            organisationMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public void updateLastGrantMadeDate(String orgId, Instant lastGrantMadeDate, Instant now) {
        jdbc.update(
            """
                UPDATE organisations
                SET last_grant_made_date = :lastGrantMadeDate,
                    updated_at = :now
                WHERE org_id = :orgId
                """,
            new MapSqlParameterSource()
                .addValue("orgId", orgId)
                .addValue("lastGrantMadeDate", toTimestamp(lastGrantMadeDate))
                .addValue("now", toTimestamp(now))
        );
    }

    // ---- grants ----

    public boolean grantExists(String grantId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM grants WHERE grant_id = :grantId",
            new MapSqlParameterSource("grantId", grantId),
            Integer.class
        );
        return count != null && count > 0;
    }

    public void upsertGrant(GrantRecord grant, String funderOrgId, String recipientOrgId, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("grantId", grant.grantId())
            .addValue("title", grant.title())
            .addValue("description", grant.description())
            .addValue("amountAwarded", grant.amountAwarded())
            .addValue("currency", grant.currency())
            .addValue("awardDate", toTimestamp(grant.awardDate()))
            .addValue("funderOrgId", funderOrgId)
            .addValue("recipientOrgId", recipientOrgId)
            .addValue("grantProgramme", toJson(grant.grantProgramme()))
            .addValue("classifications", toJson(grant.classifications()))
            .addValue("beneficiaryLocation", toJson(grant.beneficiaryLocation()))
            .addValue("rawData", grant.rawData() == null ? null : grant.rawData().toString())
            .addValue("now", toTimestamp(now));

        String update = """
            UPDATE grants
            SET title = :title,
                description = :description,
                amount_awarded = :amountAwarded,
                currency = :currency,
                award_date = :awardDate,
                funder_org_id = :funderOrgId,
                recipient_org_id = :recipientOrgId,
                grant_programme = :grantProgramme,
                classifications = :classifications,
                beneficiary_location = :beneficiaryLocation,
                raw_data = :rawData,
                updated_at = :now
            WHERE grant_id = :grantId
            """;
        int updated = jdbc.update(update, params);
        if (updated == 0) {
            try {
                jdbc.update(
                    """
                        INSERT INTO grants (
                            grant_id, title, description, amount_awarded, currency, award_date,
                            funder_org_id, recipient_org_id, grant_programme, classifications,
                            beneficiary_location, raw_data, created_at, updated_at
                        )
                        VALUES (
                            :grantId, :title, :description, :amountAwarded, :currency, :awardDate,
                            :funderOrgId, :recipientOrgId, :grantProgramme, :classifications,
                            :beneficiaryLocation, :rawData, :now, :now
                        )
                        """,
                    params
                );
            } catch (DataIntegrityViolationException ignored) {
                jdbc.update(update, params);
            }
        }
    }

    public List<StoredGrant> findRecentGrantsForFunder(String funderOrgId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return jdbc.query(
            """
                SELECT grant_id, title, description, amount_awarded, currency, award_date,
                       funder_org_id, recipient_org_id
                FROM grants
                WHERE funder_org_id = :funderOrgId
                ORDER BY award_date DESC NULLS LAST, grant_id ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("funderOrgId", funderOrgId)
                .addValue("limit", limit),
            (rs, rowNum) -> new StoredGrant(
                rs.getString("grant_id"),
                rs.getString("title"),
                rs.getString("description"),
                rs.getBigDecimal("amount_awarded"),
                rs.getString("currency"),
                toInstant(rs.getTimestamp("award_date")),
                rs.getString("funder_org_id"),
                rs.getString("recipient_org_id")
            )
        );
    }

    private RowMapper<Organisation> organisationMapper() {
        return (rs, rowNum) -> new Organisation(
            rs.getString("org_id"),
            rs.getString("name"),
            rs.getBoolean("is_funder"),
            rs.getBoolean("is_recipient"),
            readStats(rs.getString("funder_stats")),
            readStats(rs.getString("recipient_stats")),
            toInstant(rs.getTimestamp("last_grant_made_date"))
        );
    }

    private SyncLogEntry mapSyncLog(ResultSet rs, int rowNum) throws SQLException {
        return new SyncLogEntry(
            rs.getLong("id"),
            SyncType.fromDbValue(rs.getString("sync_type")),
            SyncStatus.fromDbValue(rs.getString("status")),
            rs.getInt("orgs_synced"),
            rs.getInt("grants_synced"),
            rs.getInt("grants_skipped"),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("completed_at")),
            rs.getString("error_message")
        );
    }

    private AggregateStats readStats(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, AggregateStats.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable aggregate stats column: {}", e.getOriginalMessage());
            return null;
        }
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialise " + value.getClass().getSimpleName(), e);
        }
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        String trimmed = message.trim();
        return trimmed.length() <= MAX_ERROR_MESSAGE_LENGTH ? trimmed : trimmed.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
