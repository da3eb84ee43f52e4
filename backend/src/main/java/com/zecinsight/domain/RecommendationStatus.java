package com.zecinsight.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendationStatus {
    PENDING("pending"),
    COMPLETED("completed");

    private final String value;

    RecommendationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Null for blank input (no filter); unknown values are rejected by the caller. */
    public static RecommendationStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (RecommendationStatus s : values()) {
            if (s.value.equalsIgnoreCase(value.trim())) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown recommendation status: " + value);
    }
}
