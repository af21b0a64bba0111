package com.fundermatch.grants.service;

public class GrantPayloadException extends RuntimeException {
    private final String grantId;

    public GrantPayloadException(String grantId, String message) {
        super(grantId == null ? message : "grant " + grantId + ": " + message);
        this.grantId = grantId;
    }

    public String getGrantId() {
        return grantId;
    }
}
