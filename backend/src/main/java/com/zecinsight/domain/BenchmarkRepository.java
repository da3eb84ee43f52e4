package com.zecinsight.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface BenchmarkRepository extends MongoRepository<Benchmark, String>, BenchmarkRepositoryCustom {

    Optional<Benchmark> findFirstByBenchmarkTypeAndCategoryOrderByAsOfDateDesc(String benchmarkType, String category);

    Optional<Benchmark> findFirstByBenchmarkTypeAndCategoryAndAsOfDateLessThanEqualOrderByAsOfDateDesc(
            String benchmarkType, String category, LocalDate asOf);

    Optional<Benchmark> findByBenchmarkTypeAndCategoryAndAsOfDate(String benchmarkType, String category, LocalDate asOfDate);

    List<Benchmark> findByBenchmarkTypeAndCategoryOrderByAsOfDateDesc(String benchmarkType, String category, Pageable pageable);

    List<Benchmark> findByCategoryOrderByAsOfDateDesc(String category);

    long countByCategory(String category);

    long deleteByAsOfDateBefore(LocalDate cutoff);
}
