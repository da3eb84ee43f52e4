package com.zecinsight.performance;

import com.zecinsight.common.ValidationException;
import com.zecinsight.config.AsyncConfig;
import com.zecinsight.domain.ProductivityScore;
import com.zecinsight.domain.WalletMetricSample;
import com.zecinsight.domain.WalletMetricSampleRepository;
import com.zecinsight.performance.config.PerformanceProperties;
import com.zecinsight.scoring.ProductivityScoringService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Chunked batch operations. Chunks run on the batch executor, at most {@code maxInFlightChunks} at a time; the combined result is set-equivalent to
 * processing each item on its own, in no particular order. A failing item is logged and skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BatchProcessor {

    private final ProductivityScoringService scoringService;
    private final WalletMetricSampleRepository sampleRepository;
    private final PerformanceProperties properties;
    @Qualifier(AsyncConfig.BATCH_EXECUTOR)
    private final Executor batchExecutor;

    public List<ProductivityScore> batchCalculateProductivityScores(List<String> walletIds) {
        if (walletIds == null || walletIds.isEmpty()) {
            return List.of();
        }
        List<String> distinct = walletIds.stream().distinct().toList();
        List<List<String>> chunks = chunk(distinct, properties.getBatchSize());
        List<ProductivityScore> scores = new ArrayList<>(distinct.size());
        for (List<List<String>> window : chunk(chunks, Math.max(1, properties.getMaxInFlightChunks()))) {
            List<CompletableFuture<List<ProductivityScore>>> futures = new ArrayList<>(window.size());
            for (List<String> c : window) {
                futures.add(CompletableFuture.supplyAsync(() -> scoreChunk(c), batchExecutor));
            }
            awaitWindow(futures);
            futures.forEach(f -> scores.addAll(f.join()));
        }
        log.info("Batch scored {} of {} wallet(s)", scores.size(), distinct.size());
        return List.copyOf(scores);
    }

    /**
     * Upserts samples keyed by (walletId, date) in chunks. Returns the number of records written.
     *
     * @throws ValidationException if any record lacks a walletId or date
     */
    public int batchUpdateActivityMetrics(List<WalletMetricSample> records) {
        if (records == null || records.isEmpty()) {
            return 0;
        }
        for (WalletMetricSample r : records) {
            if (r.getWalletId() == null || r.getDate() == null) {
                throw new ValidationException("Every activity record needs wallet_id and date");
            }
        }
        int updated = 0;
        for (List<WalletMetricSample> chunk : chunk(records, properties.getBatchSize())) {
            sampleRepository.upsertAll(chunk);
            updated += chunk.size();
        }
        log.debug("Upserted {} activity record(s)", updated);
        return updated;
    }

    /**
     * Waits for one window of chunks. An interrupted caller cancels the window and stops before the next one.
     */
    private static void awaitWindow(List<CompletableFuture<List<ProductivityScore>>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new CancellationException("Batch scoring interrupted");
        } catch (ExecutionException e) {
            throw new IllegalStateException("Batch scoring chunk failed", e.getCause());
        }
    }

    private List<ProductivityScore> scoreChunk(List<String> walletIds) {
        List<ProductivityScore> out = new ArrayList<>(walletIds.size());
        for (String walletId : walletIds) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            try {
                out.add(scoringService.calculate(walletId));
            } catch (RuntimeException e) {
                log.warn("Batch scoring skipped wallet {}: {}", walletId, e.getMessage());
            }
        }
        return out;
    }

    /** Splits into consecutive sublists of at most {@code size} items. */
    public static <T> List<List<T>> chunk(List<T> items, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("chunk size must be positive");
        }
        List<List<T>> chunks = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            chunks.add(items.subList(i, Math.min(items.size(), i + size)));
        }
        return chunks;
    }
}
