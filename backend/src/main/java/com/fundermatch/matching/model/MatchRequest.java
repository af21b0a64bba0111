package com.fundermatch.matching.model;

public record MatchRequest(CharityProfile charityProfile, Boolean forceRefresh) {
    public boolean isForceRefresh() {
        return Boolean.TRUE.equals(forceRefresh);
    }
}
