package com.zecinsight.alert;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertType {
    RETENTION_DROP("retention_drop", AlertCategory.RETENTION),
    RETENTION_CRITICAL("retention_critical", AlertCategory.RETENTION),
    RETENTION_WARNING("retention_warning", AlertCategory.RETENTION),
    CHURN_CRITICAL("churn_critical", AlertCategory.CHURN),
    HIGH_RISK_WALLETS("high_risk_wallets", AlertCategory.CHURN),
    COMBINED_RISK("combined_risk", AlertCategory.CHURN),
    FUNNEL_DROP_OFF("funnel_drop_off", AlertCategory.FUNNEL),
    LOW_CONVERSION("low_conversion", AlertCategory.FUNNEL),
    SHIELDED_SPIKE("shielded_spike", AlertCategory.SHIELDED),
    SHIELDED_DROP("shielded_drop", AlertCategory.SHIELDED),
    SHIELDED_VOLUME_CHANGE("shielded_volume_change", AlertCategory.SHIELDED);

    private final String value;
    private final AlertCategory category;

    AlertType(String value, AlertCategory category) {
        this.value = value;
        this.category = category;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public AlertCategory getCategory() {
        return category;
    }

    public static AlertType fromValue(String value) {
        for (AlertType t : values()) {
            if (t.value.equalsIgnoreCase(value)) {
                return t;
            }
        }
        return null;
    }
}
