package com.zecinsight.shielded;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Wallet bucket by the share of its transactions that were shielded.
 */
public enum PrivacyUsageClass {
    SHIELDED_HEAVY("shielded_heavy"),
    SHIELDED_MODERATE("shielded_moderate"),
    SHIELDED_LIGHT("shielded_light"),
    TRANSPARENT_ONLY("transparent_only");

    private final String value;

    PrivacyUsageClass(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Above 70 heavy, above 30 moderate, above 5 light, else transparent only. */
    public static PrivacyUsageClass of(double shieldedPercentage) {
        if (shieldedPercentage > 70) {
            return SHIELDED_HEAVY;
        }
        if (shieldedPercentage > 30) {
            return SHIELDED_MODERATE;
        }
        if (shieldedPercentage > 5) {
            return SHIELDED_LIGHT;
        }
        return TRANSPARENT_ONLY;
    }

    public boolean usesPrivacy() {
        return this != TRANSPARENT_ONLY;
    }
}
