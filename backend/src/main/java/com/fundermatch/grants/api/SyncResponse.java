package com.fundermatch.grants.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fundermatch.grants.model.SyncResult;
import com.fundermatch.grants.model.SyncType;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncResponse(
    boolean success,
    @JsonProperty("organisations_synced") int organisationsSynced,
    @JsonProperty("grants_synced") int grantsSynced,
    @JsonProperty("grants_skipped") int grantsSkipped,
    @JsonProperty("sync_type") SyncType syncType,
    @JsonProperty("last_sync_date") Instant lastSyncDate,
    String error
) {
    static SyncResponse completed(SyncResult result) {
        return new SyncResponse(
            true,
            result.organisationsSynced(),
            result.grantsSynced(),
            result.grantsSkipped(),
            result.syncType(),
            result.lastSyncDate(),
            null
        );
    }

    static SyncResponse failed(String error) {
        return new SyncResponse(false, 0, 0, 0, null, null, error);
    }
}
