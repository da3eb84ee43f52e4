package com.zecinsight.insight.competitive;

import com.zecinsight.comparison.OverallPosition;

import java.util.List;

public record MarketPositioning(
        OverallPosition currentPosition,
        int competitiveGaps,
        int competitiveStrengths,
        int positioningScore,
        List<String> recommendations
) {
}
