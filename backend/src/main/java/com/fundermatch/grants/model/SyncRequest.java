package com.fundermatch.grants.model;

public record SyncRequest(int maxOrganisations, int maxGrants, int offset, boolean forceFullSync) {
    public SyncRequest {
        maxOrganisations = Math.max(1, maxOrganisations);
        maxGrants = Math.max(0, maxGrants);
        offset = Math.max(0, offset);
    }
}
