package com.fundermatch.grants.model;

import java.util.List;

/**
 * One page of grants with every result already validated. {@code rejected} counts raw results
 * that failed validation and were dropped from {@code results}.
 */
public record GrantPage(int count, String next, String previous, List<GrantRecord> results, int rejected) {
    public GrantPage {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public boolean hasNext() {
        return next != null && !next.isBlank();
    }
}
