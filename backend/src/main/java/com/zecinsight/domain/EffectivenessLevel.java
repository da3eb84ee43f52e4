package com.zecinsight.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EffectivenessLevel {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String value;

    EffectivenessLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
