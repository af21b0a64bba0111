package com.fundermatch.matching.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

public record FunderGrantStats(
    @JsonProperty("total_grants") int totalGrants,
    @JsonProperty("avg_amount") BigDecimal averageAmount,
    @JsonProperty("earliest_award_date") Instant earliestAwardDate,
    @JsonProperty("latest_award_date") Instant latestAwardDate
) {
}
