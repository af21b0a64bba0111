package com.fundermatch.grants.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record GrantRecord(
    String grantId,
    String title,
    String description,
    BigDecimal amountAwarded,
    String currency,
    Instant awardDate,
    List<OrgRef> funders,
    List<OrgRef> recipients,
    List<GrantProgramme> grantProgramme,
    List<Classification> classifications,
    List<BeneficiaryLocation> beneficiaryLocation,
    JsonNode rawData
) {
    public GrantRecord {
        funders = funders == null ? List.of() : List.copyOf(funders);
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
        grantProgramme = grantProgramme == null ? List.of() : List.copyOf(grantProgramme);
        classifications = classifications == null ? List.of() : List.copyOf(classifications);
        beneficiaryLocation = beneficiaryLocation == null ? List.of() : List.copyOf(beneficiaryLocation);
    }

    public String firstFunderOrgId() {
        return firstOrgId(funders);
    }

    public String firstRecipientOrgId() {
        return firstOrgId(recipients);
    }

    private static String firstOrgId(List<OrgRef> refs) {
        if (refs.isEmpty()) {
            return null;
        }
        String orgId = refs.get(0).orgId();
        return orgId == null || orgId.isBlank() ? null : orgId;
    }
}
