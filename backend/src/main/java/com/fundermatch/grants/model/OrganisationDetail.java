package com.fundermatch.grants.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OrganisationDetail(
    @JsonProperty("org_id") String orgId,
    String name,
    AggregateStats funder,
    AggregateStats recipient
) {
    public boolean isFunder() {
        return funder != null;
    }

    public boolean isRecipient() {
        return recipient != null;
    }
}
