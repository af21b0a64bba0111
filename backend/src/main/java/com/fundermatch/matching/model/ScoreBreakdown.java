package com.fundermatch.matching.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ScoreBreakdown(
    @JsonProperty("mission_alignment") int missionAlignment,
    @JsonProperty("geographic_fit") int geographicFit,
    @JsonProperty("size_compatibility") int sizeCompatibility,
    @JsonProperty("activity_level") int activityLevel,
    @JsonProperty("historical_precedent") int historicalPrecedent
) {
}
