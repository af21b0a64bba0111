package com.fundermatch.grants.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record SyncLogEntry(
    long id,
    @JsonProperty("sync_type") SyncType syncType,
    SyncStatus status,
    @JsonProperty("orgs_synced") int organisationsSynced,
    @JsonProperty("grants_synced") int grantsSynced,
    @JsonProperty("grants_skipped") int grantsSkipped,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt,
    @JsonProperty("error_message") String errorMessage
) {
}
