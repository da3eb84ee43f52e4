package com.zecinsight.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed recommendation taxonomy with its default timeline and effort.
 */
public enum RecommendationType {
    MARKETING("marketing", "2-4 weeks", "medium"),
    ONBOARDING("onboarding", "1-3 weeks", "medium"),
    FEATURE_ENHANCEMENT("feature_enhancement", "4-8 weeks", "high"),
    RETENTION("retention", "2-6 weeks", "medium"),
    ENGAGEMENT("engagement", "1-2 weeks", "low");

    private final String value;
    private final String defaultTimeline;
    private final String effortLevel;

    RecommendationType(String value, String defaultTimeline, String effortLevel) {
        this.value = value;
        this.defaultTimeline = defaultTimeline;
        this.effortLevel = effortLevel;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDefaultTimeline() {
        return defaultTimeline;
    }

    public String getEffortLevel() {
        return effortLevel;
    }
}
