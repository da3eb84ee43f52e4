package com.zecinsight.api.controller;

import com.zecinsight.api.dto.ApiResponse;
import com.zecinsight.api.dto.StoreBenchmarkRequest;
import com.zecinsight.benchmark.BenchmarkService;
import com.zecinsight.benchmark.Percentiles;
import com.zecinsight.common.NotFoundException;
import com.zecinsight.domain.Benchmark;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.ZoneOffset;

@RestController
@RequestMapping("/api/v1/benchmarks")
@RequiredArgsConstructor
public class BenchmarkController {

    private final BenchmarkService benchmarkService;

    @GetMapping("/categories")
    public ResponseEntity<?> getCategories() {
        return ResponseEntity.ok(ApiResponse.ok(benchmarkService.getBenchmarkCategories()));
    }

    @GetMapping("/statistics")
    public ResponseEntity<?> getStatistics() {
        return ResponseEntity.ok(ApiResponse.ok(benchmarkService.getBenchmarkStatistics()));
    }

    @GetMapping("/{category}")
    public ResponseEntity<?> getByCategory(@PathVariable String category) {
        return ResponseEntity.ok(ApiResponse.ok(benchmarkService.getBenchmarksByCategory(category)));
    }

    @GetMapping("/{category}/{type}")
    public ResponseEntity<?> getLatest(@PathVariable String category, @PathVariable String type,
                                       @RequestParam(name = "as_of", required = false) LocalDate asOf) {
        Benchmark benchmark = (asOf == null
                ? benchmarkService.getLatestBenchmark(type, category)
                : benchmarkService.getBenchmarkAsOf(type, category, asOf))
                .orElseThrow(() -> new NotFoundException("No " + type + " benchmark for category " + category));
        return ResponseEntity.ok(ApiResponse.ok(benchmark));
    }

    @GetMapping("/{category}/{type}/history")
    public ResponseEntity<?> getHistory(@PathVariable String category, @PathVariable String type,
                                        @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(ApiResponse.ok(benchmarkService.getBenchmarkHistory(type, category, limit)));
    }

    @PostMapping
    public ResponseEntity<?> store(@Valid @RequestBody StoreBenchmarkRequest request) {
        LocalDate asOf = request.asOfDate() != null ? request.asOfDate() : LocalDate.now(ZoneOffset.UTC);
        Benchmark stored = benchmarkService.storeBenchmark(request.benchmarkType(), request.category(),
                new Percentiles(request.p25(), request.p50(), request.p75(), request.p90()), request.sampleSize(), asOf);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(stored, "Benchmark stored"));
    }

    @PostMapping("/{category}/recalculate")
    public ResponseEntity<?> recalculate(@PathVariable String category) {
        return ResponseEntity.ok(ApiResponse.ok(benchmarkService.recalculateCategoryBenchmarks(category)));
    }
}
