package com.fundermatch.grants.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OrganisationPage(
    int count,
    String next,
    String previous,
    List<OrganisationSummary> results
) {
    public OrganisationPage {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public boolean hasNext() {
        return next != null && !next.isBlank();
    }
}
