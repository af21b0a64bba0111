package com.fundermatch.grants.service;

import com.fundermatch.config.FunderMatchProperties;
import com.fundermatch.grants.http.GrantDataApiClient;
import com.fundermatch.grants.model.FunderRef;
import com.fundermatch.grants.model.GrantPage;
import com.fundermatch.grants.model.GrantRecord;
import com.fundermatch.grants.model.OrganisationDetail;
import com.fundermatch.grants.model.OrganisationPage;
import com.fundermatch.grants.model.OrganisationSummary;
import com.fundermatch.grants.model.SyncRequest;
import com.fundermatch.grants.model.SyncResult;
import com.fundermatch.grants.model.SyncType;
import com.fundermatch.grants.persistence.GrantJdbcRepository;
import com.fundermatch.grants.persistence.StoreException;
import com.fundermatch.matching.cache.MatchCacheService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Pulls organisations and grants from the grant-data API into the local store and records each
 * run in {@code sync_logs}.
 */
@Service
public class GrantSyncService {
    private static final Logger log = LoggerFactory.getLogger(GrantSyncService.class);

    private final GrantDataApiClient apiClient;
    private final GrantJdbcRepository repository;
    private final MatchCacheService matchCacheService;
    private final FunderMatchProperties properties;

    public GrantSyncService(
        GrantDataApiClient apiClient,
        GrantJdbcRepository repository,
        MatchCacheService matchCacheService,
        FunderMatchProperties properties
    ) {
        this.apiClient = apiClient;
        this.repository = repository;
        this.matchCacheService = matchCacheService;
        this.properties = properties;
    }

    public SyncResult runSync(SyncRequest request) {
        Instant lastCompleted;
        try {
            lastCompleted = repository.findLastCompletedSyncAt();
        } catch (DataAccessException e) {
            throw new StoreException("Unable to read sync history", e);
        }
        SyncType syncType = request.forceFullSync() || lastCompleted == null ? SyncType.FULL : SyncType.INCREMENTAL;
        Instant lastSyncDate = syncType == SyncType.INCREMENTAL ? lastCompleted : null;

        Instant startedAt = Instant.now();
        long syncLogId;
        try {
            syncLogId = repository.insertSyncLog(syncType, startedAt);
        } catch (DataAccessException e) {
            throw new StoreException("Unable to open sync log", e);
        }
        log.info(
            "Sync {} started: type={}, maxOrganisations={}, maxGrants={}, offset={}, lastSyncDate={}",
            syncLogId,
            syncType.dbValue(),
            request.maxOrganisations(),
            request.maxGrants(),
            request.offset(),
            lastSyncDate
        );

        SyncCounters counters = new SyncCounters();
        try {
            if (shouldSkipOrganisationPhase(syncType, request)) {
                log.info("Sync {}: organisation phase skipped for incremental run at offset 0", syncLogId);
            } else {
                syncOrganisations(request, counters);
            }
            syncGrants(request, lastSyncDate, counters);
        } catch (RuntimeException e) {
            log.warn("Sync {} failed", syncLogId, e);
            try {
                repository.failSyncLog(
                    syncLogId,
                    counters.organisations,
                    counters.grantsSynced,
                    counters.grantsSkipped,
                    Instant.now(),
                    describe(e)
                );
            } catch (DataAccessException logFailure) {
                e.addSuppressed(logFailure);
            }
            throw e;
        }

        Instant completedAt = Instant.now();
        try {
            repository.completeSyncLog(
                syncLogId,
                counters.organisations,
                counters.grantsSynced,
                counters.grantsSkipped,
                completedAt
            );
        } catch (DataAccessException e) {
            throw new StoreException("Unable to complete sync log " + syncLogId, e);
        }
        int invalidated = matchCacheService.invalidateBefore(completedAt);
        log.info(
            "Sync {} completed: organisations={}, grantsSynced={}, grantsSkipped={}, cacheRowsInvalidated={}",
            syncLogId,
            counters.organisations,
            counters.grantsSynced,
            counters.grantsSkipped,
            invalidated
        );
        return new SyncResult(
            syncLogId,
            counters.organisations,
            counters.grantsSynced,
            counters.grantsSkipped,
            syncType,
            lastSyncDate
        );
    }

    private boolean shouldSkipOrganisationPhase(SyncType syncType, SyncRequest request) {
        return syncType == SyncType.INCREMENTAL
            && request.offset() == 0
            && properties.getSync().isSkipOrganisationsOnIncremental();
    }

    private void syncOrganisations(SyncRequest request, SyncCounters counters) {
        OrganisationPage page = apiClient.listOrganisations(request.maxOrganisations(), request.offset());
        List<OrganisationSummary> organisations = page.results();
        log.info("Organisation phase: {} organisations from offset {}", organisations.size(), request.offset());

        for (OrganisationSummary summary : organisations) {
            if (summary.orgId() == null || summary.orgId().isBlank()) {
                continue;
            }
            try {
                OrganisationDetail detail = apiClient.getOrganisationDetail(summary.orgId());
                String name = detail.name() == null ? summary.name() : detail.name();
                repository.upsertOrganisation(summary.orgId(), name, detail, Instant.now());
                counters.organisations++;
            } catch (Exception e) {
                log.warn("Organisation {} skipped", summary.orgId(), e);
            }
        }
    }

    private void syncGrants(SyncRequest request, Instant lastSyncDate, SyncCounters counters) {
        List<FunderRef> funders;
        try {
            funders = repository.findFundersForSync(properties.getSync().getFunderBatchSize());
        } catch (DataAccessException e) {
            throw new StoreException("Unable to list funders", e);
        }
        log.info("Grant phase: {} funders, grant cap {}", funders.size(), request.maxGrants());

        int pageSize = properties.getSync().getGrantsPageSize();
        for (FunderRef funder : funders) {
            if (counters.grantsSynced >= request.maxGrants()) {
                break;
            }
            GrantPage page;
            try {
                page = apiClient.listGrantsMade(funder.orgId(), pageSize, 0);
            } catch (Exception e) {
                log.warn("Grants for funder {} could not be fetched", funder.orgId(), e);
                continue;
            }
            counters.grantsSkipped += page.rejected();

            Instant mostRecentAward = null;
            for (GrantRecord grant : page.results()) {
                if (grant.awardDate() != null
                    && (mostRecentAward == null || grant.awardDate().isAfter(mostRecentAward))) {
                    mostRecentAward = grant.awardDate();
                }
                if (counters.grantsSynced >= request.maxGrants()) {
                    continue;
                }
                syncGrant(funder, grant, lastSyncDate, counters);
            }

            if (mostRecentAward != null) {
                try {
                    repository.updateLastGrantMadeDate(funder.orgId(), mostRecentAward, Instant.now());
                } catch (DataAccessException e) {
                    log.warn("Could not record last grant date for funder {}", funder.orgId(), e);
                }
            }
        }
    }

    private void syncGrant(FunderRef funder, GrantRecord grant, Instant lastSyncDate, SyncCounters counters) {
        try {
            if (lastSyncDate != null) {
                if (grant.awardDate() != null && grant.awardDate().isBefore(lastSyncDate)) {
                    counters.grantsSkipped++;
                    return;
                }
                if (repository.grantExists(grant.grantId())) {
                    counters.grantsSkipped++;
                    return;
                }
            }
            String funderOrgId = grant.firstFunderOrgId() == null ? funder.orgId() : grant.firstFunderOrgId();
            repository.upsertGrant(grant, funderOrgId, grant.firstRecipientOrgId(), Instant.now());
            counters.grantsSynced++;
        } catch (RuntimeException e) {
            counters.grantsSkipped++;
            log.warn("Grant {} of funder {} could not be stored", grant.grantId(), funder.orgId(), e);
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static final class SyncCounters {
        private int organisations;
        private int grantsSynced;
        private int grantsSkipped;
    }
}
