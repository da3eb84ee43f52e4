package com.zecinsight.benchmark;

import com.fasterxml.jackson.annotation.JsonValue;

public enum GapStatus {
    ABOVE_TARGET("above_target"),
    BELOW_TARGET("below_target"),
    EXACT("exact"),
    NO_BENCHMARK("no_benchmark");

    private final String value;

    GapStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
