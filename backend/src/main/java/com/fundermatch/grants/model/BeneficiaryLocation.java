package com.fundermatch.grants.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BeneficiaryLocation(String name, String countryCode, String geoCode, String geoCodeType) {
}
