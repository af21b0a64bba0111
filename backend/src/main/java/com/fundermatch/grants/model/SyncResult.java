package com.fundermatch.grants.model;

import java.time.Instant;

public record SyncResult(
    long syncLogId,
    int organisationsSynced,
    int grantsSynced,
    int grantsSkipped,
    SyncType syncType,
    Instant lastSyncDate
) {
}
