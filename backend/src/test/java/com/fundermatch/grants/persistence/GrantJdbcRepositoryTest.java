package com.fundermatch.grants.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fundermatch.grants.model.AggregateStats;
import com.fundermatch.grants.model.CurrencyStats;
import com.fundermatch.grants.model.GrantRecord;
import com.fundermatch.grants.model.Organisation;
import com.fundermatch.grants.model.OrganisationDetail;
import com.fundermatch.grants.model.StoredGrant;
import com.fundermatch.grants.model.SyncLogEntry;
import com.fundermatch.grants.model.SyncStatus;
import com.fundermatch.grants.model.SyncType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class GrantJdbcRepositoryTest {

    @Autowired
    private GrantJdbcRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void organisationUpsertIsIdempotentByOrgId() {
        String orgId = "GB-CHC-" + suffix();
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);

        repository.upsertOrganisation(orgId, "Old Name", new OrganisationDetail(orgId, "Old Name", stats(3), null), now);
        repository.upsertOrganisation(orgId, "New Name", new OrganisationDetail(orgId, "New Name", stats(7), stats(1)), now);

        Integer rows = jdbc.queryForObject(
            "SELECT COUNT(*) FROM organisations WHERE org_id = :orgId",
            new MapSqlParameterSource("orgId", orgId),
            Integer.class
        );
        Organisation organisation = repository.findOrganisation(orgId);
        assertEquals(1, rows);
        assertEquals("New Name", organisation.name());
        assertTrue(organisation.funder());
        assertTrue(organisation.recipient());
        assertEquals(7, organisation.funderStats().totalGrants());
        assertEquals(0, new BigDecimal("250.00").compareTo(organisation.funderStats().currency("GBP").avg()));
    }

    @Test
    void topFundersAreOrderedByGrantCount() {
        String small = "GB-SMALL-" + suffix();
        String large = "GB-LARGE-" + suffix();
        String recipientOnly = "GB-RCPT-" + suffix();
        Instant now = Instant.now();
        repository.upsertOrganisation(small, "Small", new OrganisationDetail(small, "Small", stats(2), null), now);
        repository.upsertOrganisation(large, "Large", new OrganisationDetail(large, "Large", stats(900), null), now);
        repository.upsertOrganisation(recipientOnly, "Recipient", new OrganisationDetail(recipientOnly, "Recipient", null, stats(4)), now);

        List<String> ids = repository.findTopFunders(50).stream().map(Organisation::orgId).toList();

        assertTrue(ids.indexOf(large) < ids.indexOf(small));
        assertFalse(ids.contains(recipientOnly));
        assertTrue(repository.findFundersForSync(50).stream().anyMatch(ref -> ref.orgId().equals(small)));
    }

    @Test
    void grantUpsertKeepsSingleRowPerGrantId() {
        String grantId = "360G-" + suffix();
        Instant now = Instant.now();
        assertFalse(repository.grantExists(grantId));

        repository.upsertGrant(grant(grantId, "First title", "2023-01-01T00:00:00Z"), "GB-F", "GB-R", now);
        repository.upsertGrant(grant(grantId, "Second title", "2023-01-01T00:00:00Z"), "GB-F", "GB-R", now);

        Integer rows = jdbc.queryForObject(
            "SELECT COUNT(*) FROM grants WHERE grant_id = :grantId",
            new MapSqlParameterSource("grantId", grantId),
            Integer.class
        );
        assertEquals(1, rows);
        assertTrue(repository.grantExists(grantId));
        assertEquals("Second title", repository.findRecentGrantsForFunder("GB-F", 10).stream()
            .filter(stored -> stored.grantId().equals(grantId))
            .findFirst()
            .orElseThrow()
            .title());
    }

    @Test
    void recentGrantsAreNewestFirstWithUndatedLast() {
        String funder = "GB-FUNDER-" + suffix();
        Instant now = Instant.now();
        repository.upsertGrant(grant("360G-old-" + suffix(), "Old", "2020-05-01T00:00:00Z"), funder, null, now);
        repository.upsertGrant(grant("360G-undated-" + suffix(), "Undated", null), funder, null, now);
        repository.upsertGrant(grant("360G-new-" + suffix(), "New", "2024-05-01T00:00:00Z"), funder, null, now);

        List<StoredGrant> grants = repository.findRecentGrantsForFunder(funder, 10);

        assertEquals(List.of("New", "Old", "Undated"), grants.stream().map(StoredGrant::title).toList());
        assertEquals(2, repository.findRecentGrantsForFunder(funder, 2).size());
    }

    @Test
    void syncLogIsFinishedExactlyOnce() {
        Instant startedAt = Instant.now().plus(1, ChronoUnit.DAYS).truncatedTo(ChronoUnit.MILLIS);
        Instant completedAt = startedAt.plusSeconds(30);
        long id = repository.insertSyncLog(SyncType.FULL, startedAt);

        assertTrue(repository.findRunningSyncLogs().stream().anyMatch(entry -> entry.id() == id));

        repository.completeSyncLog(id, 4, 10, 2, completedAt);
        repository.failSyncLog(id, 0, 0, 0, completedAt.plusSeconds(5), "late failure");

        SyncLogEntry entry = repository.findSyncLog(id);
        assertNotNull(entry);
        assertEquals(SyncStatus.COMPLETED, entry.status());
        assertEquals(SyncType.FULL, entry.syncType());
        assertEquals(10, entry.grantsSynced());
        assertEquals(2, entry.grantsSkipped());
        assertNull(entry.errorMessage());
        assertEquals(completedAt, repository.findLastCompletedSyncAt());
        assertEquals(id, repository.findRecentSyncLogs(5).get(0).id());
    }

    @Test
    void failedSyncDoesNotCountAsLastCompleted() {
        Instant startedAt = Instant.now().plus(2, ChronoUnit.DAYS).truncatedTo(ChronoUnit.MILLIS);
        long id = repository.insertSyncLog(SyncType.INCREMENTAL, startedAt);
        repository.failSyncLog(id, 1, 0, 0, startedAt.plusSeconds(3), "remote down");

        Instant last = repository.findLastCompletedSyncAt();
        assertTrue(last == null || last.isBefore(startedAt));
        assertEquals("remote down", repository.findSyncLog(id).errorMessage());

        Map<String, Long> counts = repository.tableCounts();
        assertTrue(counts.get("sync_logs") >= 1);
    }

    private AggregateStats stats(int grants) {
        CurrencyStats gbp = new CurrencyStats(grants, new BigDecimal("10"), new BigDecimal("900"), new BigDecimal("250.00"), new BigDecimal("250").multiply(BigDecimal.valueOf(grants)));
        return new AggregateStats(new AggregateStats.Aggregate(grants, Map.of("GBP", gbp)));
    }

    private GrantRecord grant(String grantId, String title, String awardDate) {
        return new GrantRecord(
            grantId,
            title,
            "<p>desc</p>",
            new BigDecimal("1000.00"),
            "GBP",
            awardDate == null ? null : Instant.parse(awardDate),
            List.of(),
            List.of(),
            List.of(),
            List.of(),
            List.of(),
            objectMapper.createObjectNode().put("title", title)
        );
    }

    private static String suffix() {
        return UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }
}
