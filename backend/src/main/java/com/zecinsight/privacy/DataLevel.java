package com.zecinsight.privacy;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DataLevel {
    FULL("full"),
    AGGREGATED("aggregated");

    private final String value;

    DataLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
