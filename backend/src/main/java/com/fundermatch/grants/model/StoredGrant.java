package com.fundermatch.grants.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StoredGrant(
    @JsonProperty("grant_id") String grantId,
    String title,
    String description,
    @JsonProperty("amount_awarded") BigDecimal amountAwarded,
    String currency,
    @JsonProperty("award_date") Instant awardDate,
    @JsonProperty("funder_org_id") String funderOrgId,
    @JsonProperty("recipient_org_id") String recipientOrgId
) {
}
