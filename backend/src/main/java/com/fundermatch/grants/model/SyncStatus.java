package com.fundermatch.grants.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SyncStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SyncStatus fromDbValue(String raw) {
        return raw == null ? null : SyncStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
