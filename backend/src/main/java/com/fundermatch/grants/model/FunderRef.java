package com.fundermatch.grants.model;

import java.time.Instant;

public record FunderRef(String orgId, String name, Instant lastGrantMadeDate) {
}
