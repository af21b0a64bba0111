package com.fundermatch.grants.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CurrencyStats(
    int grants,
    BigDecimal min,
    BigDecimal max,
    BigDecimal avg,
    BigDecimal total
) {
}
