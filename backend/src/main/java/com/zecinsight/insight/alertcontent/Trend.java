package com.zecinsight.insight.alertcontent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.zecinsight.common.ValidationException;

public enum Trend {
    WORSENING("worsening"),
    STABLE("stable"),
    IMPROVING("improving");

    private final String value;

    Trend(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Null or blank means no trend information. */
    @JsonCreator
    public static Trend fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (Trend t : values()) {
            if (t.value.equalsIgnoreCase(value.trim())) {
                return t;
            }
        }
        throw new ValidationException("Invalid trend: " + value + ". Must be one of: worsening, stable, improving");
    }
}
