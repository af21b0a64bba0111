package com.fundermatch.matching.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CharityLocalAuthority(
    @JsonProperty("local_authority") String localAuthority,
    @JsonProperty("metropolitan_county") String metropolitanCounty,
    @JsonProperty("welsh_ind") Boolean welshInd
) {
}
