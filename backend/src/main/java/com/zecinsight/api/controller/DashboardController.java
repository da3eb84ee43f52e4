package com.zecinsight.api.controller;

import com.zecinsight.api.dto.ApiResponse;
import com.zecinsight.dashboard.DashboardService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/dashboard")
@RequiredArgsConstructor
public class DashboardController {

    private final DashboardService dashboardService;

    @GetMapping("/projects/{projectId}")
    public ResponseEntity<?> projectDashboard(@PathVariable String projectId) {
        return ResponseEntity.ok(ApiResponse.ok(dashboardService.getProjectDashboard(projectId)));
    }

    @GetMapping("/projects/{projectId}/health")
    public ResponseEntity<?> walletHealth(@PathVariable String projectId) {
        return ResponseEntity.ok(ApiResponse.ok(dashboardService.getWalletHealthDashboard(projectId)));
    }

    @GetMapping("/projects/{projectId}/timeseries")
    public ResponseEntity<?> timeSeries(@PathVariable String projectId,
                                        @RequestParam String metric,
                                        @RequestParam(defaultValue = "30") int days) {
        return ResponseEntity.ok(ApiResponse.ok(dashboardService.getTimeSeriesData(projectId, metric, days)));
    }

    @GetMapping("/projects/{projectId}/export")
    public ResponseEntity<?> export(@PathVariable String projectId,
                                    @RequestParam(required = false) String format) {
        return ResponseEntity.ok(ApiResponse.ok(dashboardService.exportAnalyticsReport(projectId, format)));
    }

    @DeleteMapping("/cache")
    public ResponseEntity<?> clearCache(@RequestParam(name = "project_id", required = false) String projectId) {
        dashboardService.clearDashboardCache(projectId);
        return ResponseEntity.ok(ApiResponse.ok(null, projectId == null
                ? "Dashboard cache cleared"
                : "Dashboard cache cleared for project " + projectId));
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<?> cacheStats() {
        return ResponseEntity.ok(ApiResponse.ok(dashboardService.getCacheStats()));
    }
}
