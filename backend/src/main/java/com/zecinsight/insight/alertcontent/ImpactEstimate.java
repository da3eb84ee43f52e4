package com.zecinsight.insight.alertcontent;

public record ImpactEstimate(String userImpact, String revenueImpact, String growthImpact, String overall) {
}
