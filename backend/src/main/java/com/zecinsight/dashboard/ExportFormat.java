package com.zecinsight.dashboard;

import com.fasterxml.jackson.annotation.JsonValue;
import com.zecinsight.common.ValidationException;

public enum ExportFormat {
    JSON("json"),
    CSV("csv");

    private final String value;

    ExportFormat(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Null or blank means json. */
    public static ExportFormat fromValue(String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        for (ExportFormat f : values()) {
            if (f.value.equalsIgnoreCase(value)) {
                return f;
            }
        }
        throw new ValidationException("Invalid format: " + value + ". Must be one of: json, csv");
    }
}
