package com.zecinsight.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Zcash address family of a tracked wallet.
 */
public enum WalletType {
    TRANSPARENT("t"),
    SHIELDED("z"),
    UNIFIED("u");

    private final String value;

    WalletType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Returns null for unknown codes so callers can treat the filter as absent. */
    public static WalletType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (WalletType t : values()) {
            if (t.value.equalsIgnoreCase(value.trim()) || t.name().equalsIgnoreCase(value.trim())) {
                return t;
            }
        }
        return null;
    }
}
