package com.zecinsight.api.controller;

import com.zecinsight.api.dto.ApiResponse;
import com.zecinsight.api.dto.MultiProjectComparisonRequest;
import com.zecinsight.benchmark.TargetPercentile;
import com.zecinsight.common.ValidationException;
import com.zecinsight.comparison.ComparisonService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/comparison")
@RequiredArgsConstructor
public class ComparisonController {

    static final int MAX_DAYS_BACK = 365;

    private final ComparisonService comparisonService;

    @GetMapping("/projects/{projectId}")
    public ResponseEntity<?> compareProject(@PathVariable String projectId,
                                            @RequestParam(name = "target_percentile", required = false) String target) {
        return ResponseEntity.ok(ApiResponse.ok(
                comparisonService.compareProjectToBenchmarks(projectId, TargetPercentile.fromValue(target))));
    }

    @PostMapping("/projects")
    public ResponseEntity<?> compareProjects(@Valid @RequestBody MultiProjectComparisonRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(comparisonService.compareMultipleProjects(
                request.projectIds(), TargetPercentile.fromValue(request.targetPercentile()))));
    }

    @GetMapping("/projects/{projectId}/position-changes")
    public ResponseEntity<?> positionChanges(@PathVariable String projectId,
                                             @RequestParam(name = "days_back", defaultValue = "30") int daysBack) {
        if (daysBack < 1 || daysBack > MAX_DAYS_BACK) {
            throw new ValidationException("days_back must be between 1 and " + MAX_DAYS_BACK);
        }
        return ResponseEntity.ok(ApiResponse.ok(comparisonService.trackMarketPositionChanges(projectId, daysBack)));
    }
}
