package com.zecinsight.task;

/**
 * Outcome of one completion indicator. requiredValue is the configured threshold as stored.
 */
public record IndicatorCheck(String indicator, Object requiredValue, boolean met, String details) {
}
