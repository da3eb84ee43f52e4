package com.zecinsight.dashboard;

import com.fasterxml.jackson.annotation.JsonValue;
import com.zecinsight.common.ValidationException;

public enum TimeSeriesMetric {
    ACTIVE_WALLETS("active_wallets"),
    TRANSACTIONS("transactions"),
    PRODUCTIVITY("productivity");

    private final String value;

    TimeSeriesMetric(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * @throws ValidationException for anything but active_wallets, transactions or productivity
     */
    public static TimeSeriesMetric fromValue(String value) {
        for (TimeSeriesMetric m : values()) {
            if (m.value.equalsIgnoreCase(value)) {
                return m;
            }
        }
        throw new ValidationException("Unknown metric: " + value
                + ". Must be one of: active_wallets, transactions, productivity");
    }
}
