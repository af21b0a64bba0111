package com.fundermatch.grants.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record DataFreshness(
    @JsonProperty("last_sync_at") Instant lastSyncAt,
    @JsonProperty("days_since_sync") Long daysSinceSync,
    boolean stale
) {
}
