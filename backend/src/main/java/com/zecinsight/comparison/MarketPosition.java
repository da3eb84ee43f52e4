package com.zecinsight.comparison;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MarketPosition {
    TOP_PERFORMER("top_performer"),
    ABOVE_AVERAGE("above_average"),
    AVERAGE("average"),
    BELOW_AVERAGE("below_average"),
    UNKNOWN("unknown");

    private final String value;

    MarketPosition(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
