package com.zecinsight.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Health bucket derived from the total productivity score.
 */
public enum WalletHealthStatus {
    HEALTHY("healthy"),
    AT_RISK("at_risk"),
    CHURN("churn");

    private final String value;

    WalletHealthStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
