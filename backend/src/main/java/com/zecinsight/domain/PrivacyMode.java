package com.zecinsight.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.zecinsight.common.ValidationException;

import java.util.Arrays;

/**
 * Per-wallet visibility tier. Exactly one mode at a time; new wallets start PRIVATE.
 */
public enum PrivacyMode {
    /** Owner-only. */
    PRIVATE("private"),
    /** Aggregated, anonymized metrics visible to anyone. */
    PUBLIC("public"),
    /** Full data sold per access through the marketplace. */
    MONETIZABLE("monetizable");

    private final String value;

    PrivacyMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parses the wire value (case-insensitive).
     *
     * @throws ValidationException if the value is not one of private, public, monetizable
     */
    @JsonCreator
    public static PrivacyMode fromValue(String value) {
        if (value == null) {
            throw new ValidationException("Privacy mode is required");
        }
        String v = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(m -> m.value.equals(v))
                .findFirst()
                .orElseThrow(() -> new ValidationException(
                        "Invalid privacy mode: " + value + ". Must be one of: private, public, monetizable"));
    }
}
