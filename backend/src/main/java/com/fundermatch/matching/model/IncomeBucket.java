package com.fundermatch.matching.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse income band used in cache keys so that small income changes keep the same key.
 */
public enum IncomeBucket {
    MICRO(10_000),
    SMALL(100_000),
    MEDIUM(500_000),
    LARGE(1_000_000),
    MAJOR(5_000_000),
    NATIONAL(Double.POSITIVE_INFINITY);

    private final double upperBoundExclusive;

    IncomeBucket(double upperBoundExclusive) {
        this.upperBoundExclusive = upperBoundExclusive;
    }

    public static IncomeBucket of(Double income) {
        double value = income == null || income.isNaN() ? 0d : income;
        for (IncomeBucket bucket : values()) {
            if (value < bucket.upperBoundExclusive) {
                return bucket;
            }
        }
        return NATIONAL;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
