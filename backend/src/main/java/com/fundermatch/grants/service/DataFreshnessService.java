package com.fundermatch.grants.service;

import com.fundermatch.config.FunderMatchProperties;
import com.fundermatch.grants.model.DataFreshness;
import com.fundermatch.grants.model.SyncStatusResponse;
import com.fundermatch.grants.persistence.GrantJdbcRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;

@Service
public class DataFreshnessService {
    static final int RECENT_SYNC_LIMIT = 5;

    private final GrantJdbcRepository repository;
    private final FunderMatchProperties properties;
    private final Clock clock;

    @Autowired
    public DataFreshnessService(GrantJdbcRepository repository, FunderMatchProperties properties) {
        this(repository, properties, Clock.systemUTC());
    }

    DataFreshnessService(GrantJdbcRepository repository, FunderMatchProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Stale when no sync has completed, or the latest one is older than the configured window.
     */
    public DataFreshness currentFreshness() {
        Instant lastSyncAt = repository.findLastCompletedSyncAt();
        if (lastSyncAt == null) {
            return new DataFreshness(null, null, true);
        }
        Duration age = Duration.between(lastSyncAt, clock.instant());
        long days = Math.max(0, age.toDays());
        boolean stale = age.compareTo(Duration.ofDays(properties.getSync().getStaleAfterDays())) > 0;
        return new DataFreshness(lastSyncAt, days, stale);
    }

    public SyncStatusResponse getStatus() {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception ignored) {
            dbConnected = false;
        }
        if (!dbConnected) {
            return new SyncStatusResponse(false, new DataFreshness(null, null, true), new LinkedHashMap<>(), List.of());
        }
        return new SyncStatusResponse(
            true,
            currentFreshness(),
            repository.tableCounts(),
            repository.findRecentSyncLogs(RECENT_SYNC_LIMIT)
        );
    }
}
