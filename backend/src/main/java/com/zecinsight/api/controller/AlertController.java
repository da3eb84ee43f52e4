package com.zecinsight.api.controller;

import com.zecinsight.alert.AlertService;
import com.zecinsight.api.dto.ApiResponse;
import com.zecinsight.domain.AlertThresholds;
import com.zecinsight.insight.alertcontent.AlertContentService;
import com.zecinsight.insight.alertcontent.AlertContext;
import com.zecinsight.insight.alertcontent.Trend;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/alerts")
@RequiredArgsConstructor
public class AlertController {

    private final AlertService alertService;
    private final AlertContentService alertContentService;

    @GetMapping("/projects/{projectId}")
    public ResponseEntity<?> checkAlerts(@PathVariable String projectId) {
        return ResponseEntity.ok(ApiResponse.ok(alertService.checkProjectAlerts(projectId)));
    }

    /**
     * Alerts enriched with urgency, impact, timeline and action items. trend and affected_percentage only
     * adjust urgency and priority.
     */
    @GetMapping("/projects/{projectId}/enriched")
    public ResponseEntity<?> enrichedAlerts(@PathVariable String projectId,
                                            @RequestParam(required = false) String trend,
                                            @RequestParam(name = "affected_percentage", required = false) Double affected) {
        AlertContext context = new AlertContext(Trend.fromValue(trend), affected);
        return ResponseEntity.ok(ApiResponse.ok(alertContentService.getEnrichedAlerts(projectId, context)));
    }

    @GetMapping("/projects/{projectId}/history")
    public ResponseEntity<?> history(@PathVariable String projectId, @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(ApiResponse.ok(alertService.getAlertHistory(projectId, limit)));
    }

    @GetMapping("/projects/{projectId}/configuration")
    public ResponseEntity<?> getConfiguration(@PathVariable String projectId) {
        return ResponseEntity.ok(ApiResponse.ok(alertService.getAlertConfiguration(projectId)));
    }

    @PutMapping("/projects/{projectId}/configuration")
    public ResponseEntity<?> updateConfiguration(@PathVariable String projectId,
                                                 @RequestBody AlertThresholds thresholds) {
        return ResponseEntity.ok(ApiResponse.ok(alertService.updateAlertConfiguration(projectId, thresholds),
                "Alert configuration updated"));
    }
}
