package com.zecinsight.insight.competitive;

import java.util.List;

public record StrategicRecommendation(
        String area,
        int priority,
        String type,
        String title,
        String currentState,
        String targetState,
        List<String> strategy,
        String timeline,
        String expectedImpact
) {
}
