package com.fundermatch.grants.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record SyncStatusResponse(
    @JsonProperty("db_connected") boolean dbConnected,
    DataFreshness freshness,
    Map<String, Long> counts,
    @JsonProperty("recent_syncs") List<SyncLogEntry> recentSyncs
) {
}
