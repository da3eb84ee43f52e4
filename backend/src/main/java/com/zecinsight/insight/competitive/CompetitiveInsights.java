package com.zecinsight.insight.competitive;

import com.zecinsight.comparison.OverallPosition;

import java.time.Instant;
import java.util.List;

public record CompetitiveInsights(
        String projectId,
        String projectName,
        String category,
        OverallPosition competitivePosition,
        CompetitiveAdvantage advantageScore,
        Insights insights,
        Instant generatedAt
) {

    public record Insights(
            SuccessfulPatterns successfulPatterns,
            MarketTrends marketTrends,
            List<StrategicRecommendation> strategicRecommendations,
            MarketPositioning marketPositioning,
            List<QuickWin> quickWins
    ) {
    }
}
