package com.zecinsight.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Project-level metrics compared against peer benchmarks. The wire value doubles as the benchmark type.
 */
public enum MetricType {
    PRODUCTIVITY("productivity", false),
    RETENTION("retention", false),
    ADOPTION("adoption", false),
    CHURN("churn", true);

    private final String value;
    private final boolean lowerIsBetter;

    MetricType(String value, boolean lowerIsBetter) {
        this.value = value;
        this.lowerIsBetter = lowerIsBetter;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isLowerIsBetter() {
        return lowerIsBetter;
    }

    public static MetricType fromValue(String value) {
        for (MetricType m : values()) {
            if (m.value.equalsIgnoreCase(value)) {
                return m;
            }
        }
        return null;
    }
}
