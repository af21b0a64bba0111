package com.fundermatch.matching.model;

import com.fundermatch.grants.model.Organisation;
import com.fundermatch.grants.model.StoredGrant;

import java.util.List;

public record FunderWithGrants(Organisation funder, List<StoredGrant> grants) {
    public FunderWithGrants {
        grants = grants == null ? List.of() : List.copyOf(grants);
    }
}
