package com.fundermatch.matching.persistence;

import java.time.Instant;

public record MatchCacheRow(
    long charityNumber,
    String cacheKey,
    String charityName,
    String matchesJson,
    int funderCount,
    Instant lastSyncAt,
    Instant createdAt,
    Instant expiresAt
) {
}
