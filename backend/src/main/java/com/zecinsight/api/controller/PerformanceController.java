package com.zecinsight.api.controller;

import com.zecinsight.api.dto.ActivityMetricsBatchRequest;
import com.zecinsight.api.dto.ApiResponse;
import com.zecinsight.api.dto.WalletIdsRequest;
import com.zecinsight.performance.BatchProcessor;
import com.zecinsight.performance.CacheWarmupService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Batch scoring, bulk activity upserts and cache warmup. Batch work runs off the event loop.
 */
@RestController
@RequestMapping("/api/v1/performance")
@RequiredArgsConstructor
public class PerformanceController {

    private final BatchProcessor batchProcessor;
    private final CacheWarmupService cacheWarmupService;

    @PostMapping("/scores/batch")
    public Mono<ResponseEntity<?>> batchScores(@Valid @RequestBody WalletIdsRequest request) {
        return Mono.fromCallable(() -> batchProcessor.batchCalculateProductivityScores(request.walletIds()))
                .subscribeOn(Schedulers.boundedElastic())
                .<ResponseEntity<?>>map(scores -> ResponseEntity.ok(ApiResponse.ok(scores)));
    }

    @PostMapping("/activity/batch")
    public Mono<ResponseEntity<?>> batchActivity(@Valid @RequestBody ActivityMetricsBatchRequest request) {
        return Mono.fromCallable(() -> batchProcessor.batchUpdateActivityMetrics(request.records()))
                .subscribeOn(Schedulers.boundedElastic())
                .<ResponseEntity<?>>map(updated -> ResponseEntity.ok(ApiResponse.ok(Map.of("records_updated", updated))));
    }

    @PostMapping("/cache/warmup/{projectId}")
    public ResponseEntity<?> warmup(@PathVariable String projectId) {
        cacheWarmupService.warmupCache(projectId);
        return ResponseEntity.ok(ApiResponse.ok(null, "Cache warmed for project " + projectId));
    }
}
