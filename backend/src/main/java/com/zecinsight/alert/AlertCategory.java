package com.zecinsight.alert;

public enum AlertCategory {
    RETENTION,
    CHURN,
    FUNNEL,
    SHIELDED
}
