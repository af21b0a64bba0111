package com.fundermatch.grants.service;

import com.fundermatch.config.FunderMatchProperties;
import com.fundermatch.grants.model.SyncLogEntry;
import com.fundermatch.grants.persistence.GrantJdbcRepository;
import com.fundermatch.matching.cache.MatchCacheService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Startup housekeeping: fails sync logs left {@code running} by a dead process and drops expired
 * match cache rows.
 */
@Component
public class SyncLogLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SyncLogLifecycleRunner.class);
    static final String ABORTED_ON_STARTUP = "aborted_on_startup";

    private final GrantJdbcRepository repository;
    private final MatchCacheService matchCacheService;
    private final FunderMatchProperties properties;

    public SyncLogLifecycleRunner(
        GrantJdbcRepository repository,
        MatchCacheService matchCacheService,
        FunderMatchProperties properties
    ) {
        this.repository = repository;
        this.matchCacheService = matchCacheService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping sync log cleanup because database is unreachable");
            return;
        }

        Instant cutoff = Instant.now().minus(Duration.ofMinutes(properties.getSync().getStaleRunMinutes()));
        List<SyncLogEntry> running = repository.findRunningSyncLogs();
        for (SyncLogEntry entry : running) {
            if (entry.startedAt() == null || entry.startedAt().isAfter(cutoff)) {
                continue;
            }
            repository.failSyncLog(
                entry.id(),
                entry.organisationsSynced(),
                entry.grantsSynced(),
                entry.grantsSkipped(),
                Instant.now(),
                ABORTED_ON_STARTUP
            );
            log.info("Marked stale sync {} startedAt={} as failed", entry.id(), entry.startedAt());
        }

        int purged = matchCacheService.purgeExpired();
        if (purged > 0) {
            log.info("Purged {} expired match cache rows", purged);
        }
    }
}
