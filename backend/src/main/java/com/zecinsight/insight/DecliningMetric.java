package com.zecinsight.insight;

import com.zecinsight.comparison.GapSeverity;

public record DecliningMetric(String name, int score, GapSeverity severity) {
}
