package com.zecinsight.insight.competitive;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MarketTrends(
        boolean available,
        String category,
        String message,
        Maturity marketMaturity,
        Intensity competitiveIntensity,
        List<String> emergingPatterns,
        CategoryInsights categoryInsights
) {

    public static MarketTrends unavailable(String category) {
        return new MarketTrends(false, category, "No trend data available for " + category, null, null, List.of(), null);
    }

    /** level is mature, growing, emerging or unknown. spread is p90 minus p25 of productivity. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Maturity(String level, Double spread, Double median, List<String> insights) {
    }

    public record Intensity(String intensity, int sampleSize, List<String> insights) {
    }

    public record CategoryInsights(List<String> keyMetrics, List<String> successFactors, List<String> commonPitfalls) {
    }
}
