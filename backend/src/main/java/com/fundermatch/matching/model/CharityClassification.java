package com.fundermatch.matching.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One Charity Commission "who / what / where" entry. {@code classificationType} is
 * {@code What}, {@code Who} or {@code How}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CharityClassification(
    @JsonProperty("classification_code") String classificationCode,
    @JsonProperty("classification_type") String classificationType,
    @JsonProperty("classification_desc") String classificationDesc
) {
}
