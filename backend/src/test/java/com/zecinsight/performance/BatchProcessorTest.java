package com.zecinsight.performance;

import com.zecinsight.common.ValidationException;
import com.zecinsight.config.AsyncConfig;
import com.zecinsight.domain.ProductivityScore;
import com.zecinsight.domain.WalletMetricSample;
import com.zecinsight.domain.WalletMetricSampleRepository;
import com.zecinsight.performance.config.PerformanceProperties;
import com.zecinsight.scoring.ProductivityScoringService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchProcessorTest {

    @Mock
    private ProductivityScoringService scoringService;
    @Mock
    private WalletMetricSampleRepository sampleRepository;

    private BatchProcessor processor;

    @BeforeEach
    void setUp() {
        PerformanceProperties properties = new PerformanceProperties();
        properties.setBatchSize(2);
        processor = new BatchProcessor(scoringService, sampleRepository, properties, Runnable::run);
    }

    private static ProductivityScore score(String walletId) {
        ProductivityScore s = new ProductivityScore();
        s.setWalletId(walletId);
        return s;
    }

    @Test
    @DisplayName("batch scoring covers each distinct wallet once and skips failures")
    void batchCalculateProductivityScores_distinctAndSkipsFailures() {
        when(scoringService.calculate(anyString())).thenAnswer(inv -> {
            String id = inv.getArgument(0);
            if (id.equals("w3")) {
                throw new IllegalStateException("no samples");
            }
            return score(id);
        });

        List<ProductivityScore> scores = processor.batchCalculateProductivityScores(List.of("w1", "w2", "w1", "w3", "w4"));

        assertThat(scores).extracting(ProductivityScore::getWalletId).containsExactlyInAnyOrder("w1", "w2", "w4");
        verify(scoringService, times(4)).calculate(anyString());
    }

    @Test
    @DisplayName("a list far larger than the batch pool and its queue is scored completely")
    void batchCalculateProductivityScores_largeListOnRealBatchExecutor() {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new AsyncConfig().batchExecutor();
        try {
            PerformanceProperties properties = new PerformanceProperties();
            properties.setBatchSize(100);
            BatchProcessor pooled = new BatchProcessor(scoringService, sampleRepository, properties, executor);
            when(scoringService.calculate(anyString())).thenAnswer(inv -> score(inv.getArgument(0)));
            List<String> ids = IntStream.range(0, 20_000).mapToObj(i -> "w" + i).toList();

            List<ProductivityScore> scores = pooled.batchCalculateProductivityScores(ids);

            assertThat(scores).hasSize(20_000);
            assertThat(scores).extracting(ProductivityScore::getWalletId).doesNotHaveDuplicates();
        } finally {
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("a saturated batch pool runs the chunk on the caller instead of rejecting it")
    void batchExecutor_saturated_runsOnCaller() {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new AsyncConfig().batchExecutor();
        CountDownLatch release = new CountDownLatch(1);
        try {
            for (int i = 0; i < executor.getMaxPoolSize() + executor.getQueueCapacity(); i++) {
                executor.execute(() -> {
                    try {
                        release.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
            Thread caller = Thread.currentThread();
            AtomicReference<Thread> ranOn = new AtomicReference<>();

            executor.execute(() -> ranOn.set(Thread.currentThread()));

            assertThat(ranOn.get()).isSameAs(caller);
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("empty input scores nothing")
    void batchCalculateProductivityScores_empty() {
        assertThat(processor.batchCalculateProductivityScores(List.of())).isEmpty();
        verify(scoringService, never()).calculate(anyString());
    }

    @Test
    @DisplayName("activity records are upserted in chunks of the batch size")
    void batchUpdateActivityMetrics_chunks() {
        List<WalletMetricSample> records = IntStream.range(0, 5).mapToObj(i -> {
            WalletMetricSample s = new WalletMetricSample();
            s.setWalletId("w" + i);
            s.setDate(LocalDate.of(2025, 3, 1));
            return s;
        }).toList();

        assertThat(processor.batchUpdateActivityMetrics(records)).isEqualTo(5);
        verify(sampleRepository, times(3)).upsertAll(anyList());
    }

    @Test
    @DisplayName("a record without date rejects the whole batch")
    void batchUpdateActivityMetrics_missingDate_rejected() {
        WalletMetricSample s = new WalletMetricSample();
        s.setWalletId("w1");
        assertThatThrownBy(() -> processor.batchUpdateActivityMetrics(List.of(s)))
                .isInstanceOf(ValidationException.class);
        verify(sampleRepository, never()).upsertAll(anyList());
    }

    @Test
    void chunk_splitsConsecutively() {
        assertThat(BatchProcessor.chunk(List.of(1, 2, 3, 4, 5), 2))
                .containsExactly(List.of(1, 2), List.of(3, 4), List.of(5));
    }
}
