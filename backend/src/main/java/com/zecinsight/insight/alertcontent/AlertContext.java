package com.zecinsight.insight.alertcontent;

/**
 * Optional context for enrichment. A null trend means unknown; a null affectedPercentage is read from the
 * alert data where the alert carries one.
 */
public record AlertContext(Trend trend, Double affectedPercentage) {

    public static AlertContext none() {
        return new AlertContext(null, null);
    }
}
