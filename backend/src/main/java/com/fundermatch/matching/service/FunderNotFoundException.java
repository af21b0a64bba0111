package com.fundermatch.matching.service;

public class FunderNotFoundException extends RuntimeException {
    private final String orgId;

    public FunderNotFoundException(String orgId) {
        super("Funder not found: " + orgId);
        this.orgId = orgId;
    }

    public String getOrgId() {
        return orgId;
    }
}
