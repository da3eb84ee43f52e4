package com.zecinsight.insight;

import com.zecinsight.analytics.ProjectMetricsService;
import com.zecinsight.common.ValidationException;
import com.zecinsight.domain.ProductivityScore;
import com.zecinsight.domain.Recommendation;
import com.zecinsight.domain.RecommendationRepository;
import com.zecinsight.domain.RecommendationStatus;
import com.zecinsight.scoring.ProductivityScoringService;
import com.zecinsight.task.TaskMonitoringService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Generates, stores and lists recommendations. Every stored recommendation gets a task with a baseline so
 * its effect can be measured later.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecommendationService {

    private final ProductivityScoringService scoringService;
    private final ProjectMetricsService projectMetricsService;
    private final RecommendationRepository recommendationRepository;
    private final TaskMonitoringService taskMonitoringService;

    public WalletRecommendations generateWalletRecommendations(String walletId) {
        ProductivityScore score = scoringService.calculate(walletId);
        List<DecliningMetric> declining = RecommendationEngine.identifyDecliningMetrics(score);
        List<Recommendation> recs = store(RecommendationEngine.walletRecommendations(score, declining));
        log.info("Generated {} recommendations for wallet {}", recs.size(), walletId);
        return new WalletRecommendations(walletId, score.getTotalScore(), score.getStatus(), score.getRiskLevel(),
                declining, recs, Instant.now());
    }

    public ProjectRecommendations generateProjectRecommendations(String projectId) {
        projectMetricsService.getProject(projectId);
        List<ProductivityScore> scores = projectMetricsService.getLatestScores(projectId);
        if (scores.isEmpty()) {
            return new ProjectRecommendations(projectId, 0, null, List.of(),
                    "No scored wallets found for this project", Instant.now());
        }
        ProjectHealth health = RecommendationEngine.analyzeProjectHealth(scores);
        List<Recommendation> recs = store(RecommendationEngine.projectRecommendations(projectId, health));
        log.info("Generated {} project recommendations for {}", recs.size(), projectId);
        return new ProjectRecommendations(projectId, health.totalWallets(), health, recs, null, Instant.now());
    }

    public ProjectHealth getProjectHealth(String projectId) {
        return RecommendationEngine.analyzeProjectHealth(projectMetricsService.getLatestScores(projectId));
    }

    public List<Recommendation> getWalletRecommendations(String walletId, String status) {
        RecommendationStatus s = parseStatus(status);
        return s == null
                ? recommendationRepository.findByWalletIdOrderByPriorityDescCreatedAtDesc(walletId)
                : recommendationRepository.findByWalletIdAndStatusOrderByPriorityDescCreatedAtDesc(walletId, s);
    }

    public List<Recommendation> getProjectRecommendations(String projectId, String status) {
        RecommendationStatus s = parseStatus(status);
        return s == null
                ? recommendationRepository.findByProjectIdOrderByPriorityDescCreatedAtDesc(projectId)
                : recommendationRepository.findByProjectIdAndStatusOrderByPriorityDescCreatedAtDesc(projectId, s);
    }

    private List<Recommendation> store(List<Recommendation> recs) {
        List<Recommendation> saved = recommendationRepository.saveAll(recs);
        for (Recommendation r : saved) {
            taskMonitoringService.createTask(r);
        }
        return saved;
    }

    private static RecommendationStatus parseStatus(String status) {
        try {
            return RecommendationStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid status: " + status + ". Must be one of: pending, completed");
        }
    }
}
