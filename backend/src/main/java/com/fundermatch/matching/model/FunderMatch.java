package com.fundermatch.matching.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fundermatch.grants.model.Organisation;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FunderMatch(
    Organisation funder,
    @JsonProperty("match_score") int matchScore,
    @JsonProperty("score_breakdown") ScoreBreakdown scoreBreakdown,
    String reasoning,
    @JsonProperty("similar_charities_funded") List<SimilarCharity> similarCharitiesFunded
) {
    public FunderMatch {
        similarCharitiesFunded = similarCharitiesFunded == null ? List.of() : List.copyOf(similarCharitiesFunded);
    }
}
