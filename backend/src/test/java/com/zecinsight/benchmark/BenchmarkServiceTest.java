package com.zecinsight.benchmark;

import com.zecinsight.analytics.ProjectMetricsService;
import com.zecinsight.common.ValidationException;
import com.zecinsight.domain.Benchmark;
import com.zecinsight.domain.BenchmarkRepository;
import com.zecinsight.domain.ProjectRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BenchmarkServiceTest {

    @Mock
    private BenchmarkRepository benchmarkRepository;
    @Mock
    private ProjectRepository projectRepository;
    @Mock
    private ProjectMetricsService projectMetricsService;

    @InjectMocks
    private BenchmarkService service;

    @Test
    @DisplayName("decreasing percentiles are rejected before anything is written")
    void storeBenchmark_decreasingPercentiles_rejected() {
        assertThatThrownBy(() -> service.storeBenchmark("retention_7d", "defi",
                new Percentiles(30, 20, 40, 50), 10, null))
                .isInstanceOf(ValidationException.class);
        verify(benchmarkRepository, never()).save(any());
    }

    @Test
    @DisplayName("storing for an existing day replaces that day's snapshot in place")
    void storeBenchmark_sameDay_replacesExisting() {
        LocalDate day = LocalDate.of(2025, 3, 1);
        Benchmark existing = new Benchmark();
        existing.setId("b-1");
        existing.setP50(10);
        when(benchmarkRepository.findByBenchmarkTypeAndCategoryAndAsOfDate("retention_7d", "defi", day))
                .thenReturn(Optional.of(existing));
        when(benchmarkRepository.save(any(Benchmark.class))).thenAnswer(inv -> inv.getArgument(0));

        Benchmark saved = service.storeBenchmark("retention_7d", "defi", new Percentiles(10, 20, 30, 40), 12, day);

        assertThat(saved.getId()).isEqualTo("b-1");
        assertThat(saved.getP50()).isEqualTo(20);
        assertThat(saved.getSampleSize()).isEqualTo(12);
        assertThat(saved.getAsOfDate()).isEqualTo(day);
    }

    @Test
    @DisplayName("calculating from an empty sample stores nothing")
    void calculateAndStoreBenchmark_empty_storesNothing() {
        assertThat(service.calculateAndStoreBenchmark("retention_7d", "defi", List.of())).isEmpty();
        verify(benchmarkRepository, never()).save(any());
    }

    @Test
    @DisplayName("category listing keeps only the newest snapshot per type")
    void getBenchmarksByCategory_latestPerType() {
        Benchmark newer = new Benchmark();
        newer.setId("b-3");
        newer.setBenchmarkType("retention_7d");
        newer.setAsOfDate(LocalDate.of(2025, 3, 2));
        Benchmark older = new Benchmark();
        older.setId("b-2");
        older.setBenchmarkType("retention_7d");
        older.setAsOfDate(LocalDate.of(2025, 3, 1));
        Benchmark other = new Benchmark();
        other.setId("b-1");
        other.setBenchmarkType("avg_productivity");
        other.setAsOfDate(LocalDate.of(2025, 2, 1));
        when(benchmarkRepository.findByCategoryOrderByAsOfDateDesc("defi")).thenReturn(List.of(newer, older, other));

        List<Benchmark> result = service.getBenchmarksByCategory("defi");

        assertThat(result).containsExactly(newer, other);
    }
}
