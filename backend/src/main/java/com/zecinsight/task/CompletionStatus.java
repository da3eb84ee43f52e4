package com.zecinsight.task;

import java.util.List;

public record CompletionStatus(
        boolean isCompleted,
        int metCount,
        int totalIndicators,
        double completionPercentage,
        List<IndicatorCheck> indicatorsMet,
        List<IndicatorCheck> indicatorsPending
) {

    public static CompletionStatus none() {
        return new CompletionStatus(false, 0, 0, 0, List.of(), List.of());
    }
}
