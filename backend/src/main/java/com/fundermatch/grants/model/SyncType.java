package com.fundermatch.grants.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SyncType {
    FULL,
    INCREMENTAL;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SyncType fromDbValue(String raw) {
        return raw == null ? null : SyncType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
