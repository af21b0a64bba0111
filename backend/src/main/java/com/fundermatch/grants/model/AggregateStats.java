package com.fundermatch.grants.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Funder or recipient aggregate published by the grant-data API, keyed by ISO currency code.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AggregateStats(Aggregate aggregate) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Aggregate(int grants, Map<String, CurrencyStats> currencies) {
        public Aggregate {
            currencies = currencies == null ? Map.of() : Map.copyOf(currencies);
        }
    }

    public int totalGrants() {
        return aggregate == null ? 0 : Math.max(0, aggregate.grants());
    }

    public CurrencyStats currency(String code) {
        if (aggregate == null || code == null) {
            return null;
        }
        return aggregate.currencies().get(code);
    }
}
