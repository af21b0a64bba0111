package com.fundermatch.matching.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SimilarCharity(
    @JsonProperty("charity_name") String charityName,
    @JsonProperty("grant_amount") BigDecimal grantAmount,
    @JsonProperty("award_date") String awardDate,
    @JsonProperty("grant_purpose") String grantPurpose
) {
}
