package com.zecinsight.insight.competitive;

import com.zecinsight.benchmark.BenchmarkService;
import com.zecinsight.benchmark.TargetPercentile;
import com.zecinsight.comparison.ComparisonService;
import com.zecinsight.comparison.ProjectComparison;
import com.zecinsight.domain.Benchmark;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Project-vs-category insights. Compares against the p75 target, the level a competitive project reaches.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompetitiveInsightsService {

    private final ComparisonService comparisonService;
    private final BenchmarkService benchmarkService;

    public CompetitiveInsights generateCompetitiveInsights(String projectId) {
        ProjectComparison comparison = comparisonService.compareProjectToBenchmarks(projectId, TargetPercentile.P75);
        String category = comparison.category();
        List<Benchmark> benchmarks = benchmarkService.getBenchmarksByCategory(category);

        SuccessfulPatterns patterns = CompetitiveAnalyzer.analyzeSuccessfulPatterns(category, benchmarks);
        MarketTrends trends = CompetitiveAnalyzer.identifyCompetitiveTrends(category, benchmarks);
        CompetitiveInsights.Insights insights = new CompetitiveInsights.Insights(
                patterns,
                trends,
                CompetitiveAnalyzer.generateStrategicRecommendations(comparison, patterns, trends),
                CompetitiveAnalyzer.analyzeMarketPositioning(comparison),
                CompetitiveAnalyzer.identifyQuickWins(comparison));
        CompetitiveAdvantage advantage = CompetitiveAnalyzer.calculateCompetitiveAdvantage(comparison);
        log.debug("Competitive insights for {}: advantage {} ({})", projectId, advantage.score(), advantage.level());
        return new CompetitiveInsights(projectId, comparison.projectName(), category,
                comparison.overallPosition(), advantage, insights, Instant.now());
    }
}
