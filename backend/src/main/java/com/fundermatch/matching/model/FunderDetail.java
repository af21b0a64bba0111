package com.fundermatch.matching.model;

import com.fundermatch.grants.model.Organisation;
import com.fundermatch.grants.model.StoredGrant;

import java.util.List;

public record FunderDetail(Organisation funder, List<StoredGrant> grants, FunderGrantStats stats) {
}
