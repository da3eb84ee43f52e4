package com.zecinsight.api.controller;

import com.zecinsight.api.dto.ApiResponse;
import com.zecinsight.shielded.ShieldedComparisonService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/shielded")
@RequiredArgsConstructor
public class ShieldedController {

    private final ShieldedComparisonService shieldedComparisonService;

    @GetMapping("/projects/{projectId}/comparison")
    public ResponseEntity<?> compare(@PathVariable String projectId, @RequestParam(required = false) Integer days) {
        return ResponseEntity.ok(ApiResponse.ok(shieldedComparisonService.compare(projectId, days)));
    }
}
