package com.zecinsight.api.controller;

import com.zecinsight.api.dto.ApiResponse;
import com.zecinsight.insight.RecommendationService;
import com.zecinsight.insight.competitive.CompetitiveInsightsService;
import com.zecinsight.task.TaskMonitoringService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Competitive insights, recommendations and the tasks that track them.
 */
@RestController
@RequestMapping("/api/v1/insights")
@RequiredArgsConstructor
public class InsightController {

    private final CompetitiveInsightsService competitiveInsightsService;
    private final RecommendationService recommendationService;
    private final TaskMonitoringService taskMonitoringService;

    @GetMapping("/projects/{projectId}/competitive")
    public ResponseEntity<?> competitiveInsights(@PathVariable String projectId) {
        return ResponseEntity.ok(ApiResponse.ok(competitiveInsightsService.generateCompetitiveInsights(projectId)));
    }

    @GetMapping("/projects/{projectId}/health")
    public ResponseEntity<?> projectHealth(@PathVariable String projectId) {
        return ResponseEntity.ok(ApiResponse.ok(recommendationService.getProjectHealth(projectId)));
    }

    @PostMapping("/wallets/{walletId}/recommendations")
    public ResponseEntity<?> generateWalletRecommendations(@PathVariable String walletId) {
        return ResponseEntity.ok(ApiResponse.ok(recommendationService.generateWalletRecommendations(walletId)));
    }

    @GetMapping("/wallets/{walletId}/recommendations")
    public ResponseEntity<?> walletRecommendations(@PathVariable String walletId,
                                                   @RequestParam(required = false) String status) {
        return ResponseEntity.ok(ApiResponse.ok(recommendationService.getWalletRecommendations(walletId, status)));
    }

    @PostMapping("/projects/{projectId}/recommendations")
    public ResponseEntity<?> generateProjectRecommendations(@PathVariable String projectId) {
        return ResponseEntity.ok(ApiResponse.ok(recommendationService.generateProjectRecommendations(projectId)));
    }

    @GetMapping("/projects/{projectId}/recommendations")
    public ResponseEntity<?> projectRecommendations(@PathVariable String projectId,
                                                    @RequestParam(required = false) String status) {
        return ResponseEntity.ok(ApiResponse.ok(recommendationService.getProjectRecommendations(projectId, status)));
    }

    @PostMapping("/recommendations/{recommendationId}/check")
    public ResponseEntity<?> checkTask(@PathVariable String recommendationId) {
        return ResponseEntity.ok(ApiResponse.ok(taskMonitoringService.monitorTask(recommendationId)));
    }

    @PostMapping("/recommendations/{recommendationId}/baseline")
    public ResponseEntity<?> resetBaseline(@PathVariable String recommendationId) {
        return ResponseEntity.ok(ApiResponse.ok(taskMonitoringService.setBaselineMetrics(recommendationId)));
    }

    @PostMapping("/wallets/{walletId}/tasks/check")
    public ResponseEntity<?> checkWalletTasks(@PathVariable String walletId) {
        return ResponseEntity.ok(ApiResponse.ok(taskMonitoringService.monitorWalletRecommendations(walletId)));
    }

    @PostMapping("/projects/{projectId}/tasks/check")
    public ResponseEntity<?> checkProjectTasks(@PathVariable String projectId) {
        return ResponseEntity.ok(ApiResponse.ok(taskMonitoringService.monitorProjectRecommendations(projectId)));
    }
}
