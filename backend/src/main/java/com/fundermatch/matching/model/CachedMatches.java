package com.fundermatch.matching.model;

import java.time.Instant;
import java.util.List;

public record CachedMatches(String cacheKey, List<FunderMatch> matches, Instant createdAt, Instant lastSyncAt) {
}
