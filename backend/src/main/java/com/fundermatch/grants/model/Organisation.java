package com.fundermatch.grants.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Organisation(
    @JsonProperty("org_id") String orgId,
    String name,
    @JsonProperty("is_funder") boolean funder,
    @JsonProperty("is_recipient") boolean recipient,
    @JsonProperty("funder_stats") AggregateStats funderStats,
    @JsonProperty("recipient_stats") AggregateStats recipientStats,
    @JsonProperty("last_grant_made_date") Instant lastGrantMadeDate
) {
}
