package com.zecinsight.insight.alertcontent;

public record Urgency(String level, int score, String responseTime, String rationale) {
}
