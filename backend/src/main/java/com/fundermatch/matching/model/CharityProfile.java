package com.fundermatch.matching.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * The subset of a Charity Commission register entry that matching reads. Unknown register
 * fields are accepted and ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CharityProfile(
    @JsonProperty("reg_charity_number") Long regCharityNumber,
    @JsonProperty("charity_name") String charityName,
    @JsonProperty("latest_income") Double latestIncome,
    @JsonProperty("latest_expenditure") Double latestExpenditure,
    @JsonProperty("who_what_where") List<CharityClassification> whoWhatWhere,
    @JsonProperty("CharityAoORegion") List<CharityRegion> regions,
    @JsonProperty("CharityAoOLocalAuthority") List<CharityLocalAuthority> localAuthorities
) {
    public static final String WHAT = "What";
    public static final String WHO = "Who";

    public CharityProfile {
        whoWhatWhere = whoWhatWhere == null ? List.of() : whoWhatWhere.stream().filter(Objects::nonNull).toList();
        regions = regions == null ? List.of() : regions.stream().filter(Objects::nonNull).toList();
        localAuthorities = localAuthorities == null
            ? List.of()
            : localAuthorities.stream().filter(Objects::nonNull).toList();
    }

    @JsonIgnore
    public boolean isIdentified() {
        return regCharityNumber != null && charityName != null && !charityName.isBlank();
    }

    public List<String> classificationCodes(String type) {
        return whoWhatWhere.stream()
            .filter(entry -> type.equals(entry.classificationType()))
            .map(CharityClassification::classificationCode)
            .filter(Objects::nonNull)
            .toList();
    }

    public List<String> classificationDescriptions(String type) {
        return whoWhatWhere.stream()
            .filter(entry -> type.equals(entry.classificationType()))
            .map(CharityClassification::classificationDesc)
            .filter(Objects::nonNull)
            .toList();
    }

    public List<String> regionNames() {
        return regions.stream().map(CharityRegion::region).filter(Objects::nonNull).toList();
    }

    public List<String> localAuthorityNames() {
        return localAuthorities.stream()
            .map(CharityLocalAuthority::localAuthority)
            .filter(Objects::nonNull)
            .toList();
    }
}
